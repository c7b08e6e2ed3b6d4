package com.scholary.captions.style;

/**
 * Fully typed caption styling configuration.
 *
 * <p>Built once per request by {@link StyleOptionsNormalizer}; every key has its default filled in
 * except {@code fontSize}, which depends on the video height and is filled by {@link
 * #withDefaultFontSize(int)} once the resolution is known.
 *
 * <p>Colors are kept as the {@code #RRGGBB} strings the caller supplied; conversion to ASS colors
 * happens when the header and events are rendered.
 */
public record StyleOptions(
    String fontFamily,
    Integer fontSize,
    String lineColor,
    String wordColor,
    String boxColor,
    String outlineColor,
    boolean bold,
    boolean italic,
    boolean underline,
    boolean strikeout,
    double scaleX,
    double scaleY,
    double spacing,
    double angle,
    int borderStyle,
    double outlineWidth,
    double shadowOffset,
    boolean box,
    int marginL,
    int marginR,
    int marginV,
    String position,
    String alignment,
    Integer x,
    Integer y,
    boolean allCaps,
    int maxWordsPerLine,
    String style) {

  public static final String DEFAULT_FONT_FAMILY = "Arial";
  public static final String DEFAULT_STYLE = "classic";

  /** Options with every default applied and no font size yet. */
  public static StyleOptions defaults() {
    return new StyleOptions(
        DEFAULT_FONT_FAMILY,
        null,
        "#FFFFFF",
        "#FFFF00",
        "#000000",
        "#000000",
        false,
        false,
        false,
        false,
        100,
        100,
        0,
        0,
        1,
        2,
        0,
        false,
        20,
        20,
        20,
        "middle_center",
        "center",
        null,
        null,
        false,
        0,
        DEFAULT_STYLE);
  }

  /**
   * Fill in the font size default of 5% of the video height.
   *
   * @param videoHeight script height in pixels
   * @return these options if a size was requested, otherwise a copy with the default size
   */
  public StyleOptions withDefaultFontSize(int videoHeight) {
    if (fontSize != null) {
      return this;
    }
    return new StyleOptions(
        fontFamily,
        (int) (videoHeight * 0.05),
        lineColor,
        wordColor,
        boxColor,
        outlineColor,
        bold,
        italic,
        underline,
        strikeout,
        scaleX,
        scaleY,
        spacing,
        angle,
        borderStyle,
        outlineWidth,
        shadowOffset,
        box,
        marginL,
        marginR,
        marginV,
        position,
        alignment,
        x,
        y,
        allCaps,
        maxWordsPerLine,
        style);
  }
}
