package com.scholary.captions.error;

/**
 * Caption content cannot be used as requested.
 *
 * <p>Raised for unparseable SRT blocks and for SRT input combined with a style other than classic.
 */
public class CaptionFormatException extends CaptionException {

  public CaptionFormatException(String message) {
    super(ErrorKind.FORMAT, message);
  }

  public CaptionFormatException(String message, Throwable cause) {
    super(ErrorKind.FORMAT, message, cause);
  }
}
