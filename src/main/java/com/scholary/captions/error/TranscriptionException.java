package com.scholary.captions.error;

/** Speech recognition failed for the downloaded media. */
public class TranscriptionException extends CaptionException {

  public TranscriptionException(String message, Throwable cause) {
    super(ErrorKind.TRANSCRIPTION, message, cause);
  }
}
