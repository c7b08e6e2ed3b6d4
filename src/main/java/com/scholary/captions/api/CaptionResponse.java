package com.scholary.captions.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Successful synchronous caption response.
 *
 * @param jobId job id, also the output file name
 * @param outputPath local path of the {@code .ass} file
 * @param outputUrl presigned download URL when published, otherwise absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CaptionResponse(String jobId, String outputPath, String outputUrl) {}
