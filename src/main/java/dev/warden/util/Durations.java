/* Warden © 2025 Warden Devs — MIT */
package dev.warden.util;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Parsing and formatting of moderation durations such as {@code 30m}, {@code 2d}, {@code perm}. */
public final class Durations {
  private static final long SECOND = 1_000L;
  private static final long MINUTE = 60 * SECOND;
  private static final long HOUR = 60 * MINUTE;
  private static final long DAY = 24 * HOUR;
  private static final long WEEK = 7 * DAY;
  private static final long MONTH = 30 * DAY;
  private static final long YEAR = 365 * DAY;

  private static final Pattern INPUT = Pattern.compile("^(\\d+)\\s*([A-Za-z]+)$");

  private static final Map<String, Long> UNITS =
      Map.ofEntries(
          Map.entry("s", SECOND),
          Map.entry("sec", SECOND),
          Map.entry("second", SECOND),
          Map.entry("seconds", SECOND),
          Map.entry("m", MINUTE),
          Map.entry("min", MINUTE),
          Map.entry("mins", MINUTE),
          Map.entry("minute", MINUTE),
          Map.entry("minutes", MINUTE),
          Map.entry("h", HOUR),
          Map.entry("hr", HOUR),
          Map.entry("hour", HOUR),
          Map.entry("hours", HOUR),
          Map.entry("d", DAY),
          Map.entry("day", DAY),
          Map.entry("days", DAY),
          Map.entry("w", WEEK),
          Map.entry("week", WEEK),
          Map.entry("weeks", WEEK),
          Map.entry("mo", MONTH),
          Map.entry("month", MONTH),
          Map.entry("months", MONTH),
          Map.entry("y", YEAR),
          Map.entry("year", YEAR),
          Map.entry("years", YEAR));

  private Durations() {}

  /**
   * Parses a duration.
   *
   * <p>{@code perm} and {@code permanent} yield {@code null}. Otherwise the input is a positive
   * count followed by a unit; {@code M} (upper case) is a 30-day month while {@code m} is a minute.
   *
   * @param raw user input
   * @return milliseconds, or {@code null} for permanent
   * @throws IllegalArgumentException if the input is not a recognised duration
   */
  public static Long parse(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("duration required");
    }
    String trimmed = raw.trim();
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (lower.equals("perm") || lower.equals("permanent")) {
      return null;
    }
    Matcher m = INPUT.matcher(trimmed);
    if (!m.matches()) {
      throw new IllegalArgumentException("Bad duration: " + raw);
    }
    String unit = m.group(2);
    Long scale = unit.equals("M") ? Long.valueOf(MONTH) : UNITS.get(unit.toLowerCase(Locale.ROOT));
    if (scale == null) {
      throw new IllegalArgumentException("Unknown duration unit: " + unit);
    }
    long count;
    try {
      count = Long.parseLong(m.group(1));
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Bad duration: " + raw, e);
    }
    if (count <= 0) {
      throw new IllegalArgumentException("Duration must be positive: " + raw);
    }
    try {
      return Math.multiplyExact(count, scale);
    } catch (ArithmeticException e) {
      throw new IllegalArgumentException("Duration too large: " + raw, e);
    }
  }

  /**
   * Formats a duration with its two most significant units, e.g. {@code 1d 3h}.
   *
   * @param durationMs milliseconds, or {@code null} for permanent
   * @return short label
   */
  public static String format(Long durationMs) {
    if (durationMs == null) {
      return "permanent";
    }
    long rest = Math.max(0L, durationMs);
    long[] scales = {YEAR, WEEK, DAY, HOUR, MINUTE, SECOND};
    String[] labels = {"y", "w", "d", "h", "m", "s"};
    StringBuilder out = new StringBuilder();
    int parts = 0;
    for (int i = 0; i < scales.length && parts < 2; i++) {
      long n = rest / scales[i];
      if (n > 0) {
        if (out.length() > 0) {
          out.append(' ');
        }
        out.append(n).append(labels[i]);
        rest -= n * scales[i];
        parts++;
      }
    }
    return out.length() == 0 ? "0s" : out.toString();
  }
}
