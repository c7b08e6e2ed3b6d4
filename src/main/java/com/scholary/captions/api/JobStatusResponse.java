package com.scholary.captions.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.scholary.captions.error.ErrorKind;
import java.util.List;

/**
 * Response for job status query.
 *
 * <p>Shows the current state of an async job, with the output location once completed or the
 * error once failed. {@code availableFonts} is only set for font failures.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobStatusResponse(
    String jobId,
    Status status,
    String outputPath,
    String outputUrl,
    String error,
    ErrorKind errorKind,
    List<String> availableFonts,
    String kibanaUrl) {

  public enum Status {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
  }
}
