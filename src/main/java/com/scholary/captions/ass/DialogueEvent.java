package com.scholary.captions.ass;

/**
 * One {@code Dialogue:} line of the {@code [Events]} section.
 *
 * <p>Every event uses the {@code Default} style with zero margins and no effect; positioning and
 * colors are carried by the override blocks in front of the text.
 *
 * @param layer 0 for base lines, 1 for overlays drawn on top
 * @param start start time in seconds
 * @param end end time in seconds
 * @param positionTag anchor and position override block
 * @param colorOverride color override block, empty when the style color applies
 * @param text dialogue text, may contain further override blocks and {@code \N} breaks
 */
public record DialogueEvent(
    int layer, double start, double end, String positionTag, String colorOverride, String text) {

  public static final String LINE_BREAK = "\\N";

  public DialogueEvent {
    colorOverride = colorOverride == null ? "" : colorOverride;
  }

  /** Color override block for a primary color, e.g. {@code {\c&H0000FFFF}}. */
  public static String colorTag(String assColor) {
    return "{\\c" + assColor + "}";
  }

  public String toAssLine() {
    return "Dialogue: "
        + layer
        + ","
        + AssTime.format(start)
        + ","
        + AssTime.format(end)
        + ",Default,,0,0,0,,"
        + positionTag
        + colorOverride
        + text;
  }
}
