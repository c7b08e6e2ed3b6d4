package com.scholary.captions.job;

import com.scholary.captions.api.JobStatusResponse.Status;
import com.scholary.captions.service.CaptionOrchestrator;
import com.scholary.captions.service.CaptionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Runs caption jobs on the async executor.
 *
 * <p>Lives in its own bean so the {@code @Async} proxy applies when the controller calls it.
 */
@Service
public class CaptionJobRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionJobRunner.class);

  private final CaptionOrchestrator orchestrator;
  private final JobRepository jobRepository;

  public CaptionJobRunner(CaptionOrchestrator orchestrator, JobRepository jobRepository) {
    this.orchestrator = orchestrator;
    this.jobRepository = jobRepository;
  }

  @Async
  public void run(CaptionJob job) {
    LOGGER.info("Starting async processing for job: {}", job.getJobId());
    job.setStatus(Status.PROCESSING);
    jobRepository.save(job);

    CaptionOutcome outcome = orchestrator.generate(job.getRequest(), job.getJobId());
    job.complete(outcome);
    jobRepository.save(job);

    LOGGER.info("Finished async processing for job: {} ({})", job.getJobId(), job.getStatus());
  }
}
