package com.scholary.captions.error;

/**
 * Category of a failed captioning request.
 *
 * <p>The REST layer maps each kind to an HTTP status; the job status endpoint reports the kind
 * alongside the message.
 */
public enum ErrorKind {
  VALIDATION,
  FONT_UNAVAILABLE,
  SOURCE_RETRIEVAL,
  TRANSCRIPTION,
  FORMAT,
  PERSISTENCE,
  INTERNAL
}
