package com.scholary.captions.error;

/** Malformed request settings, replace entries or exclude ranges. */
public class ValidationException extends CaptionException {

  public ValidationException(String message) {
    super(ErrorKind.VALIDATION, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(ErrorKind.VALIDATION, message, cause);
  }
}
