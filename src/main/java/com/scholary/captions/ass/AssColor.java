package com.scholary.captions.ass;

import java.util.Locale;
import java.util.regex.Pattern;

/** Converts {@code #RRGGBB} colors to the ASS {@code &HAABBGGRR} encoding. */
public final class AssColor {

  public static final String WHITE = "&H00FFFFFF";

  private static final Pattern HEX_RGB = Pattern.compile("[0-9a-fA-F]{6}");

  private AssColor() {}

  /**
   * Convert an RGB hex color to an opaque ASS color.
   *
   * <p>Malformed input (named colors, short hex, null) falls back to opaque white instead of
   * failing the request.
   *
   * @param hex color such as {@code #FF0000} or {@code FF0000}
   * @return ASS color such as {@code &H000000FF}
   */
  public static String fromRgb(String hex) {
    if (hex == null) {
      return WHITE;
    }
    String digits = hex.trim();
    if (digits.startsWith("#")) {
      digits = digits.substring(1);
    }
    if (!HEX_RGB.matcher(digits).matches()) {
      return WHITE;
    }
    digits = digits.toUpperCase(Locale.ROOT);
    String red = digits.substring(0, 2);
    String green = digits.substring(2, 4);
    String blue = digits.substring(4, 6);
    return "&H00" + blue + green + red;
  }
}
