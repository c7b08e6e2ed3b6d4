package com.scholary.captions.ass;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the ASS anchor code and absolute position for a caption run.
 *
 * <p>Two modes:
 *
 * <ol>
 *   <li>Explicit coordinates: when both {@code x} and {@code y} are given, the position keyword is
 *       ignored, the anchor sits on the middle row and the alignment keyword picks the column.
 *   <li>Grid: the frame is split into a 3x3 grid. The position keyword ({@code top_left} ...
 *       {@code bottom_right}) picks the cell, the alignment keyword picks the point inside the
 *       cell: its left edge, its right edge or its vertical midline. The y coordinate is always the
 *       vertical center of the cell.
 * </ol>
 *
 * <p>Grid coordinates are truncated to whole pixels.
 */
public final class AlignmentResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(AlignmentResolver.class);

  private static final int TOP_ROW = 7;
  private static final int MIDDLE_ROW = 4;
  private static final int BOTTOM_ROW = 1;

  private AlignmentResolver() {}

  /**
   * Determine anchor code and pixel position.
   *
   * @param position grid cell keyword, e.g. {@code top_right}; null means middle_center
   * @param alignment {@code left}, {@code center} or {@code right}; anything else means center
   * @param x explicit x coordinate, may be null
   * @param y explicit y coordinate, may be null
   * @param videoWidth script width in pixels
   * @param videoHeight script height in pixels
   * @return the resolved placement
   */
  public static Placement resolve(
      String position, String alignment, Integer x, Integer y, int videoWidth, int videoHeight) {
    int horizontalCode = horizontalCode(alignment);

    if (x != null && y != null) {
      Placement placement = new Placement(MIDDLE_ROW + (horizontalCode - 1), x, y);
      LOGGER.debug("Using explicit position: alignment={}, placement={}", alignment, placement);
      return placement;
    }

    String cell = position == null ? "middle_center" : position.toLowerCase(Locale.ROOT);

    int verticalBase;
    double verticalCenter;
    if (cell.contains("top")) {
      verticalBase = TOP_ROW;
      verticalCenter = videoHeight / 6.0;
    } else if (cell.contains("middle")) {
      verticalBase = MIDDLE_ROW;
      verticalCenter = videoHeight / 2.0;
    } else {
      verticalBase = BOTTOM_ROW;
      verticalCenter = (5.0 * videoHeight) / 6.0;
    }

    double leftBoundary;
    double rightBoundary;
    double centerLine;
    if (cell.contains("left")) {
      leftBoundary = 0;
      rightBoundary = videoWidth / 3.0;
      centerLine = videoWidth / 6.0;
    } else if (cell.contains("right")) {
      leftBoundary = (2.0 * videoWidth) / 3.0;
      rightBoundary = videoWidth;
      centerLine = (5.0 * videoWidth) / 6.0;
    } else {
      leftBoundary = videoWidth / 3.0;
      rightBoundary = (2.0 * videoWidth) / 3.0;
      centerLine = videoWidth / 2.0;
    }

    double finalX;
    if (horizontalCode == 1) {
      finalX = leftBoundary;
    } else if (horizontalCode == 3) {
      finalX = rightBoundary;
    } else {
      finalX = centerLine;
    }

    Placement placement =
        new Placement(verticalBase + (horizontalCode - 1), (int) finalX, (int) verticalCenter);
    LOGGER.debug(
        "Resolved grid position: position={}, alignment={}, video={}x{}, placement={}",
        cell,
        alignment,
        videoWidth,
        videoHeight,
        placement);
    return placement;
  }

  private static int horizontalCode(String alignment) {
    if (alignment == null) {
      return 2;
    }
    String normalized = alignment.toLowerCase(Locale.ROOT);
    if (normalized.equals("left")) {
      return 1;
    }
    if (normalized.equals("right")) {
      return 3;
    }
    return 2;
  }
}
