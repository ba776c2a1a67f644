package com.consullo.agentstream.detect.review;

import org.apache.commons.lang3.Validate;

/**
 * One validated code review finding.
 *
 * @param file file path as reported
 * @param line first line, or null when not reported
 * @param endLine last line, or null
 * @param severity normalized severity
 * @param category category, {@code General} when not reported
 * @param title short title
 * @param description description
 * @param suggestion suggested fix, or null
 * @since 1.0
 */
public record ReviewFinding(
    String file,
    Integer line,
    Integer endLine,
    Severity severity,
    String category,
    String title,
    String description,
    String suggestion) {

  public ReviewFinding {
    Validate.notBlank(file, "file must not be blank");
    Validate.notNull(severity, "severity must not be null");
    Validate.notBlank(title, "title must not be blank");
    Validate.notBlank(description, "description must not be blank");
    if (category == null || category.isBlank()) {
      category = "General";
    }
  }
}
