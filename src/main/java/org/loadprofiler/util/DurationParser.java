package org.loadprofiler.util;

import java.time.Duration;

/**
 * Parses the duration strings used in benchmark plans: {@code "250ms"}, {@code "30s"}, {@code
 * "5m"}, or a bare number of milliseconds.
 */
public final class DurationParser {

  private DurationParser() {}

  /**
   * @return the parsed duration, or {@link Duration#ZERO} if the input is null or blank
   * @throws IllegalArgumentException if the value is negative or not a number
   */
  public static Duration parse(String duration) {
    if (duration == null || duration.trim().isEmpty()) {
      return Duration.ZERO;
    }

    var trimmed = duration.trim().toLowerCase();
    try {
      Duration parsed;
      if (trimmed.endsWith("ms")) {
        parsed = Duration.ofMillis(Long.parseLong(trimmed.substring(0, trimmed.length() - 2).trim()));
      } else if (trimmed.endsWith("s")) {
        parsed = Duration.ofSeconds(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
      } else if (trimmed.endsWith("m")) {
        parsed = Duration.ofMinutes(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()));
      } else {
        parsed = Duration.ofMillis(Long.parseLong(trimmed));
      }
      if (parsed.isNegative()) {
        throw new IllegalArgumentException("Duration must not be negative: " + duration);
      }
      return parsed;
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Unparseable duration: " + duration, e);
    }
  }

  public static String format(Duration duration) {
    long millis = duration.toMillis();
    if (millis % 60_000 == 0 && millis > 0) {
      return millis / 60_000 + "m";
    }
    if (millis % 1000 == 0 && millis > 0) {
      return millis / 1000 + "s";
    }
    return millis + "ms";
  }
}
