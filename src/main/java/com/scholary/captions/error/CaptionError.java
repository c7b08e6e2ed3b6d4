package com.scholary.captions.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

/**
 * Structured error returned for a failed request.
 *
 * <p>{@code availableFonts} is only present for font failures and is left out of the JSON body
 * otherwise.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CaptionError(String error, ErrorKind kind, List<String> availableFonts) {

  public static CaptionError of(ErrorKind kind, String message) {
    return new CaptionError(message, kind, null);
  }
}
