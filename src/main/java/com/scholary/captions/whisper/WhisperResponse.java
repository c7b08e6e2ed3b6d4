package com.scholary.captions.whisper;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.TranscriptionResult;
import com.scholary.captions.transcript.WordTiming;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Response from the Whisper transcription API.
 *
 * <p>Contains a list of segments, each with word timings, and the detected language.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WhisperResponse(List<WhisperSegment> segments, String language) {

  private static final Logger LOGGER = LoggerFactory.getLogger(WhisperResponse.class);

  /** A segment as returned by the API. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record WhisperSegment(double start, double end, String text, List<WhisperWord> words) {}

  /** A word as returned by the API; the text usually carries a leading space. */
  @JsonIgnoreProperties(ignoreUnknown = true)
  public record WhisperWord(String word, double start, double end) {}

  /**
   * Convert to the caption model.
   *
   * <p>Word text is trimmed. Segments with no duration are dropped with a warning.
   */
  public TranscriptionResult toTranscriptionResult() {
    List<Segment> converted = new ArrayList<>();
    if (segments != null) {
      for (WhisperSegment segment : segments) {
        if (segment.end() <= segment.start()) {
          LOGGER.warn(
              "Skipping zero-length segment at {}s: '{}'", segment.start(), segment.text());
          continue;
        }
        List<WordTiming> words = new ArrayList<>();
        if (segment.words() != null) {
          for (WhisperWord word : segment.words()) {
            String text = word.word() == null ? "" : word.word().trim();
            words.add(new WordTiming(text, word.start(), word.end()));
          }
        }
        String text = segment.text() == null ? "" : segment.text();
        converted.add(new Segment(segment.start(), segment.end(), text, words));
      }
    }
    return new TranscriptionResult(converted, language);
  }
}
