package com.scholary.captions.whisper;

/** The transcription service could not produce word timings for a media file. */
public class WhisperException extends RuntimeException {

  private final int attempts;

  public WhisperException(String message, int attempts, Throwable cause) {
    super(message, cause);
    this.attempts = attempts;
  }

  /** Number of requests sent before giving up, 0 if none completed. */
  public int attempts() {
    return attempts;
  }
}
