package com.scholary.captions.ass;

import com.scholary.captions.error.ValidationException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Conversions between seconds and the textual time formats used by captions.
 *
 * <ul>
 *   <li>ASS time: {@code H:MM:SS.cc} (centiseconds, hours of any width)
 *   <li>Request time strings: {@code H:MM:SS[.ms]}, {@code MM:SS[.ms]} or bare {@code SS[.ms]}
 *   <li>SRT time: {@code HH:MM:SS,mmm}
 * </ul>
 */
public final class AssTime {

  // Example: 1:02:03.450, 02:03.4, 2:03
  private static final Pattern TIME_STRING_PATTERN =
      Pattern.compile("^(?:(\\d+):)?(\\d{1,2}):(\\d{2}(?:\\.\\d{1,3})?)$");
  private static final Pattern SECONDS_PATTERN = Pattern.compile("^-?\\d+(?:\\.\\d+)?$");
  private static final Pattern ASS_TIME_PATTERN =
      Pattern.compile("^\\s*(\\d+):(\\d{1,2}):(\\d{1,2})\\.(\\d{1,2})\\s*$");

  private AssTime() {}

  /**
   * Format seconds as ASS time.
   *
   * <p>Rounding works on the total number of centiseconds, so 59.999s becomes {@code 0:01:00.00}
   * rather than an invalid {@code 0:00:59.100}.
   *
   * @param seconds time in seconds, negative values are clamped to zero
   * @return the ASS time string
   */
  public static String format(double seconds) {
    long totalCentis = Math.round(Math.max(0.0, seconds) * 100.0);
    long hours = totalCentis / 360_000;
    long minutes = (totalCentis % 360_000) / 6_000;
    long secs = (totalCentis % 6_000) / 100;
    long centis = totalCentis % 100;
    return String.format("%d:%02d:%02d.%02d", hours, minutes, secs, centis);
  }

  /**
   * Parse an ASS time back to seconds.
   *
   * <p>Lenient: a value that does not look like ASS time yields 0.
   */
  public static double parse(String assTime) {
    if (assTime == null) {
      return 0.0;
    }
    Matcher matcher = ASS_TIME_PATTERN.matcher(assTime);
    if (!matcher.matches()) {
      return 0.0;
    }
    String centis = matcher.group(4);
    double fraction = Integer.parseInt(centis) / (centis.length() == 1 ? 10.0 : 100.0);
    return Integer.parseInt(matcher.group(1)) * 3600.0
        + Integer.parseInt(matcher.group(2)) * 60.0
        + Integer.parseInt(matcher.group(3))
        + fraction;
  }

  /**
   * Parse a request time string.
   *
   * @param text {@code H:MM:SS[.ms]}, {@code MM:SS[.ms]} or {@code SS[.ms]}
   * @return seconds
   * @throws ValidationException if the text matches none of the formats
   */
  public static double parseTimeString(String text) {
    if (text == null) {
      throw new ValidationException("Time value must be a string in hh:mm:ss.ms format.");
    }
    String trimmed = text.trim();
    Matcher matcher = TIME_STRING_PATTERN.matcher(trimmed);
    if (matcher.matches()) {
      int hours = matcher.group(1) == null ? 0 : Integer.parseInt(matcher.group(1));
      int minutes = Integer.parseInt(matcher.group(2));
      double secs = Double.parseDouble(matcher.group(3));
      return hours * 3600 + minutes * 60 + secs;
    }
    if (SECONDS_PATTERN.matcher(trimmed).matches()) {
      return Double.parseDouble(trimmed);
    }
    throw new ValidationException("Invalid time string: " + text);
  }

  /** Format seconds as SRT time {@code HH:MM:SS,mmm}. */
  public static String formatSrt(double seconds) {
    long totalMillis = Math.round(Math.max(0.0, seconds) * 1000.0);
    long hours = totalMillis / 3_600_000;
    long minutes = (totalMillis % 3_600_000) / 60_000;
    long secs = (totalMillis % 60_000) / 1000;
    long millis = totalMillis % 1000;
    return String.format("%02d:%02d:%02d,%03d", hours, minutes, secs, millis);
  }
}
