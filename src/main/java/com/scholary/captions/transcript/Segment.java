package com.scholary.captions.transcript;

import java.util.List;

/**
 * A contiguous phrase with start/end time, its text and optional word-level timings.
 *
 * <p>Segments built from SRT blocks or plain text carry no word timings, so the word-level styles
 * produce nothing for them.
 */
public record Segment(double start, double end, String text, List<WordTiming> words) {

  public Segment {
    if (end <= start) {
      throw new IllegalArgumentException(
          String.format("Segment end (%s) must be greater than start (%s)", end, start));
    }
    text = text == null ? "" : text;
    words = words == null ? List.of() : List.copyOf(words);
  }

  /** Segment without word timings. */
  public static Segment ofText(double start, double end, String text) {
    return new Segment(start, end, text, List.of());
  }

  public boolean hasWords() {
    return !words.isEmpty();
  }
}
