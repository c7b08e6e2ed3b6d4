package com.scholary.captions.transcript;

import java.util.List;

/**
 * Uniform transcription model consumed by the style handlers.
 *
 * <p>Every caption source (speech recognition, SRT, plain text) is converted into this shape once,
 * so that the rendering code never looks at raw caption content again.
 *
 * @param segments segments in playback order
 * @param language detected or requested language, may be null when unknown
 */
public record TranscriptionResult(List<Segment> segments, String language) {

  public TranscriptionResult {
    segments = segments == null ? List.of() : List.copyOf(segments);
  }

  public static TranscriptionResult of(List<Segment> segments) {
    return new TranscriptionResult(segments, null);
  }

  public int wordCount() {
    return segments.stream().mapToInt(segment -> segment.words().size()).sum();
  }
}
