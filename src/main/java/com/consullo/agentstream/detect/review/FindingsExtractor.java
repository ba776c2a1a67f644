package com.consullo.agentstream.detect.review;

import com.consullo.agentstream.core.json.BalancedSpanScanner;
import com.consullo.agentstream.core.json.JsonRecords;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.math.NumberUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recovers review findings from the accumulated output of a review run.
 *
 * <p>Strategies, first match wins:
 * <ol>
 * <li>a fenced {@code ```json} block holding an array;</li>
 * <li>the first balanced {@code [...]} that parses as a non-empty array of objects;</li>
 * <li>a "no issues" phrase or a literal empty array, giving an empty result.</li>
 * </ol>
 * Candidates whose entries are all rejected (for example the echoed prompt template) are skipped
 * so that a later candidate can still match.
 *
 * @since 1.0
 */
final class FindingsExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(FindingsExtractor.class);

  private static final Pattern FENCED_JSON = Pattern.compile("```json\\s*\\n(.*?)\\n```", Pattern.DOTALL);

  private static final Pattern[] NO_ISSUES_PATTERNS = {
    Pattern.compile("no\\s+issues?\\s+found", Pattern.CASE_INSENSITIVE),
    Pattern.compile("code\\s+looks?\\s+good", Pattern.CASE_INSENSITIVE),
    Pattern.compile("no\\s+problems?\\s+(found|detected)", Pattern.CASE_INSENSITIVE),
    Pattern.compile("everything\\s+looks?\\s+(good|fine|ok)", Pattern.CASE_INSENSITIVE),
    Pattern.compile("\\[\\s*\\]"),
  };

  private FindingsExtractor() {
  }

  /**
   * Extracts findings from a buffer.
   *
   * @param buffer accumulated, ANSI-stripped output
   * @return findings (possibly empty when the agent reported no issues), or empty when the buffer
   *     does not yet contain a result
   */
  static Optional<List<ReviewFinding>> extract(final String buffer) {
    Matcher fenced = FENCED_JSON.matcher(buffer);
    while (fenced.find()) {
      Optional<JsonNode> parsed = JsonRecords.parse(fenced.group(1));
      if (parsed.isPresent() && parsed.get().isArray()) {
        List<ReviewFinding> findings = validate(parsed.get());
        if (!findings.isEmpty() || parsed.get().isEmpty()) {
          LOGGER.debug("Found {} finding(s) in fenced JSON block", findings.size());
          return Optional.of(findings);
        }
      }
    }

    for (int start = buffer.indexOf('['); start >= 0; start = buffer.indexOf('[', start + 1)) {
      int end = BalancedSpanScanner.findClose(buffer, start, '[', ']');
      if (end == BalancedSpanScanner.UNTERMINATED) {
        continue;
      }
      Optional<JsonNode> parsed = JsonRecords.parse(buffer.substring(start, end + 1));
      if (parsed.isPresent() && isArrayOfObjects(parsed.get())) {
        List<ReviewFinding> findings = validate(parsed.get());
        if (!findings.isEmpty()) {
          LOGGER.debug("Found {} finding(s) in bracketed array at offset {}", findings.size(), start);
          return Optional.of(findings);
        }
      }
    }

    for (Pattern pattern : NO_ISSUES_PATTERNS) {
      if (pattern.matcher(buffer).find()) {
        LOGGER.debug("Review output reports no issues");
        return Optional.of(List.of());
      }
    }
    return Optional.empty();
  }

  /**
   * Validates raw entries, dropping incomplete ones and prompt-template look-alikes.
   *
   * @param array JSON array
   * @return accepted findings in input order
   */
  static List<ReviewFinding> validate(final JsonNode array) {
    List<ReviewFinding> findings = new ArrayList<>();
    for (JsonNode item : array) {
      String file = JsonRecords.nonEmptyText(item, "file");
      String severityText = JsonRecords.nonEmptyText(item, "severity");
      String title = JsonRecords.nonEmptyText(item, "title");
      String description = JsonRecords.nonEmptyText(item, "description");
      if (StringUtils.isAnyBlank(file, severityText, title, description)) {
        LOGGER.warn("Skipping finding with missing fields: {}", item);
        continue;
      }
      String category = JsonRecords.nonEmptyText(item, "category");
      if (severityText.contains("|")
          || StringUtils.contains(category, "|")
          || file.contains("relative/path")
          || title.contains("Short title")) {
        LOGGER.debug("Skipping template example: {}", item);
        continue;
      }
      Optional<Severity> severity = Severity.parse(severityText);
      if (severity.isEmpty()) {
        LOGGER.warn("Skipping finding with unknown severity '{}'", severityText);
        continue;
      }
      findings.add(new ReviewFinding(
          file,
          lineNumber(item.get("line")),
          lineNumber(item.get("endLine")),
          severity.get(),
          category,
          title,
          description,
          JsonRecords.nonEmptyText(item, "suggestion")));
    }
    return findings;
  }

  private static boolean isArrayOfObjects(JsonNode node) {
    if (!node.isArray() || node.isEmpty()) {
      return false;
    }
    for (JsonNode element : node) {
      if (!element.isObject()) {
        return false;
      }
    }
    return true;
  }

  // numbers or numeric strings; 0 and anything else count as absent
  private static Integer lineNumber(JsonNode value) {
    int line = 0;
    if (value != null && value.canConvertToInt()) {
      line = value.asInt();
    } else if (value != null && value.isTextual()) {
      line = NumberUtils.toInt(value.asText().trim(), 0);
    }
    return line > 0 ? line : null;
  }
}
