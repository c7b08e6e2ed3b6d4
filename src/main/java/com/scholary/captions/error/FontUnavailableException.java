package com.scholary.captions.error;

import java.util.List;

/**
 * The requested font family is not installed.
 *
 * <p>Carries the complete list of available families so the caller can pick one that exists. This
 * is the only failure that reports the font list.
 */
public class FontUnavailableException extends CaptionException {

  private final List<String> availableFonts;

  public FontUnavailableException(String requestedFont, List<String> availableFonts) {
    super(ErrorKind.FONT_UNAVAILABLE, String.format("Font '%s' not available.", requestedFont));
    this.availableFonts = List.copyOf(availableFonts);
  }

  public List<String> getAvailableFonts() {
    return availableFonts;
  }

  @Override
  public CaptionError toError() {
    return new CaptionError(getMessage(), getKind(), availableFonts);
  }
}
