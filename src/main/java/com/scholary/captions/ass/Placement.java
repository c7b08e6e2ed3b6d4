package com.scholary.captions.ass;

/**
 * Where a dialogue is pinned on screen.
 *
 * @param anchorCode ASS numpad anchor, 1-3 bottom row, 4-6 middle row, 7-9 top row
 * @param x horizontal pixel position in script resolution
 * @param y vertical pixel position in script resolution
 */
public record Placement(int anchorCode, int x, int y) {

  public Placement {
    if (anchorCode < 1 || anchorCode > 9) {
      throw new IllegalArgumentException("Anchor code must be between 1 and 9: " + anchorCode);
    }
  }

  /** Override block, e.g. {@code {\an8\pos(960,180)}}. */
  public String positionTag() {
    return "{\\an" + anchorCode + "\\pos(" + x + "," + y + ")}";
  }
}
