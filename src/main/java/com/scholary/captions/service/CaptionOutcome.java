package com.scholary.captions.service;

import com.scholary.captions.error.CaptionError;
import java.nio.file.Path;

/**
 * Result of one caption job: either an output file or exactly one error.
 *
 * @param jobId job id
 * @param outputPath written {@code .ass} file, null on failure
 * @param outputUrl presigned URL when published, otherwise null
 * @param error failure details, null on success
 */
public record CaptionOutcome(String jobId, Path outputPath, String outputUrl, CaptionError error) {

  public static CaptionOutcome success(String jobId, Path outputPath, String outputUrl) {
    return new CaptionOutcome(jobId, outputPath, outputUrl, null);
  }

  public static CaptionOutcome failure(String jobId, CaptionError error) {
    return new CaptionOutcome(jobId, null, null, error);
  }

  public boolean isSuccess() {
    return error == null;
  }
}
