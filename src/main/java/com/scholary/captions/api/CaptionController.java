package com.scholary.captions.api;

import com.scholary.captions.api.JobStatusResponse.Status;
import com.scholary.captions.error.CaptionError;
import com.scholary.captions.job.CaptionJob;
import com.scholary.captions.job.CaptionJobRunner;
import com.scholary.captions.job.JobRepository;
import com.scholary.captions.monitoring.KibanaUrlGenerator;
import com.scholary.captions.service.CaptionOrchestrator;
import com.scholary.captions.service.CaptionOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for caption generation.
 *
 * <p>Provides endpoints for:
 *
 * <ul>
 *   <li>Asynchronous generation (returns job ID immediately)
 *   <li>Synchronous generation (returns the file location or the error)
 *   <li>Job status polling
 * </ul>
 */
@RestController
@Tag(name = "Captions", description = "ASS caption generation API")
public class CaptionController {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionController.class);

  private final CaptionOrchestrator orchestrator;
  private final CaptionJobRunner jobRunner;
  private final JobRepository jobRepository;
  private final KibanaUrlGenerator kibanaUrlGenerator;

  public CaptionController(
      CaptionOrchestrator orchestrator,
      CaptionJobRunner jobRunner,
      JobRepository jobRepository,
      KibanaUrlGenerator kibanaUrlGenerator) {
    this.orchestrator = orchestrator;
    this.jobRunner = jobRunner;
    this.jobRepository = jobRepository;
    this.kibanaUrlGenerator = kibanaUrlGenerator;
  }

  /** Start asynchronous caption job. */
  @PostMapping("/api/captions")
  @Operation(
      summary = "Start caption generation",
      description = "Start asynchronous caption job and return job ID for status polling")
  public ResponseEntity<AsyncJobResponse> generate(@Valid @RequestBody CaptionRequest request) {
    String jobId = jobIdFor(request);
    CaptionJob job = new CaptionJob(jobId, request);
    if (!jobRepository.saveIfAbsent(job)) {
      LOGGER.warn("Rejected caption request, job {} already exists", jobId);
      return ResponseEntity.status(HttpStatus.CONFLICT).build();
    }

    LOGGER.info("Created async caption job: {}", jobId);
    jobRunner.run(job);

    return ResponseEntity.accepted()
        .body(new AsyncJobResponse(jobId, kibanaUrlGenerator.generateJobUrl(jobId)));
  }

  /** Generate captions and wait for the result. */
  @PostMapping("/api/captions/sync")
  @Operation(
      summary = "Generate captions synchronously",
      description =
          "Run the caption pipeline in the request thread. Returns the output location, or the "
              + "error with 400 for bad input, 502 for failing upstreams and 500 otherwise.")
  public ResponseEntity<?> generateSync(@Valid @RequestBody CaptionRequest request) {
    String jobId = jobIdFor(request);
    CaptionOutcome outcome = orchestrator.generate(request, jobId);

    if (outcome.isSuccess()) {
      return ResponseEntity.ok(
          new CaptionResponse(jobId, outcome.outputPath().toString(), outcome.outputUrl()));
    }
    CaptionError error = outcome.error();
    return ResponseEntity.status(statusFor(error)).body(error);
  }

  /**
   * Get job status.
   *
   * <p>Completed jobs include the output location, failed jobs the error.
   */
  @GetMapping("/api/jobs/{id}")
  @Operation(summary = "Get job status", description = "Check the status of an async caption job")
  public ResponseEntity<JobStatusResponse> getJobStatus(@PathVariable String id) {
    return jobRepository
        .findById(id)
        .map(job -> ResponseEntity.ok(toStatusResponse(job)))
        .orElse(ResponseEntity.notFound().build());
  }

  private JobStatusResponse toStatusResponse(CaptionJob job) {
    String kibanaUrl = kibanaUrlGenerator.generateJobUrl(job.getJobId());
    CaptionOutcome outcome = job.getOutcome();
    if (outcome == null) {
      return new JobStatusResponse(
          job.getJobId(), job.getStatus(), null, null, null, null, null, kibanaUrl);
    }
    if (outcome.isSuccess()) {
      return new JobStatusResponse(
          job.getJobId(),
          Status.COMPLETED,
          outcome.outputPath().toString(),
          outcome.outputUrl(),
          null,
          null,
          null,
          kibanaUrl);
    }
    CaptionError error = outcome.error();
    return new JobStatusResponse(
        job.getJobId(),
        Status.FAILED,
        null,
        null,
        error.error(),
        error.kind(),
        error.availableFonts(),
        kibanaUrl);
  }

  static HttpStatus statusFor(CaptionError error) {
    switch (error.kind()) {
      case VALIDATION:
      case FORMAT:
      case FONT_UNAVAILABLE:
        return HttpStatus.BAD_REQUEST;
      case SOURCE_RETRIEVAL:
      case TRANSCRIPTION:
        return HttpStatus.BAD_GATEWAY;
      default:
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
  }

  private static String jobIdFor(CaptionRequest request) {
    if (request.id() != null && !request.id().isBlank()) {
      return request.id().trim();
    }
    return UUID.randomUUID().toString();
  }
}
