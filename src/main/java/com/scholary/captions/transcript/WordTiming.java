package com.scholary.captions.transcript;

/**
 * Timing of a single spoken word inside a segment.
 *
 * <p>Times are absolute seconds from the start of the media, with fractional precision.
 */
public record WordTiming(String word, double start, double end) {

  public WordTiming {
    word = word == null ? "" : word;
  }

  public double duration() {
    return end - start;
  }
}
