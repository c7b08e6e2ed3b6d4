package com.scholary.captions.whisper;

import com.scholary.captions.transcript.TranscriptionResult;
import java.nio.file.Path;

/**
 * Speech-to-text with word level timestamps.
 *
 * <p>Captions without a supplied source are produced from this; the karaoke, highlight, underline
 * and word-by-word styles need the word timings.
 */
public interface WhisperService {

  /** Language hint meaning "let the model detect it". */
  String AUTO_LANGUAGE = "auto";

  /**
   * Transcribe a media file.
   *
   * @param mediaFile local audio or video file
   * @param language ISO language code, or {@code auto}/null to detect
   * @return segments with word timings
   * @throws WhisperException if transcription fails
   */
  TranscriptionResult transcribe(Path mediaFile, String language);
}
