package com.scholary.captions.ass;

import com.scholary.captions.fonts.FontCatalog;
import com.scholary.captions.media.VideoResolution;
import com.scholary.captions.style.StyleOptions;
import java.math.BigDecimal;
import java.util.StringJoiner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds the ASS script header: {@code [Script Info]}, a single {@code Default} style and the
 * {@code [Events]} format line.
 *
 * <p>The style alignment is a placeholder (5); every dialogue event sets its own anchor with an
 * {@code \an} override.
 */
@Component
public class AssHeaderBuilder {

  private static final Logger LOGGER = LoggerFactory.getLogger(AssHeaderBuilder.class);

  private static final int PLACEHOLDER_ALIGNMENT = 5;
  private static final int OPAQUE_BOX_BORDER_STYLE = 3;

  static final String STYLE_FORMAT =
      "Format: Name, Fontname, Fontsize, PrimaryColour, SecondaryColour, OutlineColour,"
          + " BackColour, Bold, Italic, Underline, StrikeOut, ScaleX, ScaleY, Spacing, Angle,"
          + " BorderStyle, Outline, Shadow, Alignment, MarginL, MarginR, MarginV, Encoding";

  static final String EVENTS_FORMAT =
      "Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text";

  private final FontCatalog fontCatalog;

  public AssHeaderBuilder(FontCatalog fontCatalog) {
    this.fontCatalog = fontCatalog;
  }

  /**
   * Build the header.
   *
   * <p>The font must already have been checked against the catalog; here it is only mapped to the
   * name fontconfig resolves.
   *
   * @param options style options, font size filled in
   * @param resolution script resolution
   * @return header text ending with the events format line and a newline
   */
  public String build(StyleOptions options, VideoResolution resolution) {
    String fontName = fontCatalog.resolveAssFamily(options.fontFamily());
    int fontSize =
        options.fontSize() != null ? options.fontSize() : (int) (resolution.height() * 0.05);
    String lineColor = AssColor.fromRgb(options.lineColor());

    StringJoiner style = new StringJoiner(",", "Style: ", "");
    style
        .add("Default")
        .add(fontName)
        .add(String.valueOf(fontSize))
        .add(lineColor)
        .add(lineColor)
        .add(AssColor.fromRgb(options.outlineColor()))
        .add(AssColor.fromRgb(options.boxColor()))
        .add(flag(options.bold()))
        .add(flag(options.italic()))
        .add(flag(options.underline()))
        .add(flag(options.strikeout()))
        .add(number(options.scaleX()))
        .add(number(options.scaleY()))
        .add(number(options.spacing()))
        .add(number(options.angle()))
        .add(String.valueOf(options.box() ? OPAQUE_BOX_BORDER_STYLE : options.borderStyle()))
        .add(number(options.outlineWidth()))
        .add(number(options.shadowOffset()))
        .add(String.valueOf(PLACEHOLDER_ALIGNMENT))
        .add(String.valueOf(options.marginL()))
        .add(String.valueOf(options.marginR()))
        .add(String.valueOf(options.marginV()))
        .add("0");

    LOGGER.debug("Header style line: {}", style);

    return "[Script Info]\n"
        + "ScriptType: v4.00+\n"
        + "PlayResX: "
        + resolution.width()
        + "\n"
        + "PlayResY: "
        + resolution.height()
        + "\n"
        + "ScaledBorderAndShadow: yes\n"
        + "\n"
        + "[V4+ Styles]\n"
        + STYLE_FORMAT
        + "\n"
        + style
        + "\n"
        + "\n"
        + "[Events]\n"
        + EVENTS_FORMAT
        + "\n";
  }

  private static String flag(boolean value) {
    return value ? "1" : "0";
  }

  /** Integral values print without a fraction, e.g. {@code 100} rather than {@code 100.0}. */
  static String number(double value) {
    return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
  }
}
