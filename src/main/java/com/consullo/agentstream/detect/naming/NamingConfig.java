package com.consullo.agentstream.detect.naming;

import java.time.Duration;
import org.apache.commons.lang3.Validate;

/**
 * Configuration for {@link AutoNamingDetector}.
 *
 * @param debounce quiet period after the last chunk before a name is requested
 * @param cooldown minimum time between two name changes for a session
 * @param minOutputLength minimum buffered characters before a name is requested
 * @param bufferSize maximum buffered characters per session
 * @param suggestionTimeout upper bound for one {@link NameSuggester} call
 * @since 1.0
 */
public record NamingConfig(
    Duration debounce,
    Duration cooldown,
    int minOutputLength,
    int bufferSize,
    Duration suggestionTimeout) {

  public NamingConfig {
    Validate.notNull(debounce, "debounce must not be null");
    Validate.notNull(cooldown, "cooldown must not be null");
    Validate.notNull(suggestionTimeout, "suggestionTimeout must not be null");
    Validate.isTrue(!debounce.isNegative(), "debounce must not be negative");
    Validate.isTrue(minOutputLength >= 0, "minOutputLength must not be negative");
    Validate.isTrue(bufferSize > 0, "bufferSize must be positive");
    Validate.isTrue(!suggestionTimeout.isNegative() && !suggestionTimeout.isZero(), "suggestionTimeout must be positive");
  }

  public static NamingConfig defaults() {
    return new NamingConfig(Duration.ofSeconds(2), Duration.ofSeconds(30), 100, 5000, Duration.ofSeconds(10));
  }
}
