package com.scholary.captions.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Request for generating an ASS caption file for a video.
 *
 * <p>{@code settings}, {@code replace} and {@code exclude_time_ranges} are kept as raw JSON values
 * and validated by the pipeline, so a malformed value is reported the same way whether the job runs
 * synchronously or asynchronously.
 *
 * @param videoUrl video to caption
 * @param captions ASS, SRT or plain text captions, or a URL to fetch them from; absent means
 *     transcribe the video
 * @param settings style settings object
 * @param replace list of {@code {find, replace}} objects
 * @param excludeTimeRanges list of {@code {start, end}} time strings
 * @param language transcription language hint, {@code auto} to detect
 * @param playResX script width override, used together with {@code playResY}
 * @param playResY script height override, used together with {@code playResX}
 * @param id caller supplied job id, also the output file name
 * @param publish upload the result to object storage
 */
public record CaptionRequest(
    @JsonProperty("video_url") @NotBlank String videoUrl,
    @JsonProperty("captions") String captions,
    @JsonProperty("settings") Object settings,
    @JsonProperty("replace") Object replace,
    @JsonProperty("exclude_time_ranges") Object excludeTimeRanges,
    @JsonProperty("language") String language,
    @JsonProperty("PlayResX") @Positive Integer playResX,
    @JsonProperty("PlayResY") @Positive Integer playResY,
    @JsonProperty("id") String id,
    @JsonProperty("publish") Boolean publish) {

  public CaptionRequest {
    if (publish == null) {
      publish = false;
    }
  }
}
