package com.scholary.captions.filter;

/**
 * A time span, in seconds, whose captions must not be shown.
 *
 * <p>Ranges are independent of each other; they may overlap and need not be sorted.
 */
public record ExcludeRange(double start, double end) {

  public ExcludeRange {
    if (start < 0 || end < 0) {
      throw new IllegalArgumentException("Exclude range times cannot be negative");
    }
    if (end <= start) {
      throw new IllegalArgumentException("Exclude range end must be greater than start");
    }
  }

  /**
   * Check if a caption interval overlaps this range.
   *
   * <p>Intervals are half-open: a caption ending exactly where the range starts, or starting
   * exactly where it ends, does not overlap.
   *
   * @param captionStart caption start in seconds
   * @param captionEnd caption end in seconds
   * @return true if the caption must be dropped
   */
  public boolean overlaps(double captionStart, double captionEnd) {
    return captionStart < end && captionEnd > start;
  }
}
