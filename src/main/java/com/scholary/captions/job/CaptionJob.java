package com.scholary.captions.job;

import com.scholary.captions.api.CaptionRequest;
import com.scholary.captions.api.JobStatusResponse.Status;
import com.scholary.captions.service.CaptionOutcome;

/**
 * Represents an async caption job.
 *
 * <p>Tracks the job's state and, once finished, its outcome. Stored in memory using Caffeine cache.
 */
public class CaptionJob {

  private final String jobId;
  private final CaptionRequest request;

  private volatile Status status;
  private volatile CaptionOutcome outcome;

  public CaptionJob(String jobId, CaptionRequest request) {
    this.jobId = jobId;
    this.request = request;
    this.status = Status.PENDING;
  }

  public String getJobId() {
    return jobId;
  }

  public CaptionRequest getRequest() {
    return request;
  }

  public Status getStatus() {
    return status;
  }

  public void setStatus(Status status) {
    this.status = status;
  }

  public CaptionOutcome getOutcome() {
    return outcome;
  }

  /** Record the outcome and move to COMPLETED or FAILED accordingly. */
  public void complete(CaptionOutcome outcome) {
    this.outcome = outcome;
    this.status = outcome.isSuccess() ? Status.COMPLETED : Status.FAILED;
  }
}
