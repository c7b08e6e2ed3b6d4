package com.scholary.captions.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.Optional;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

/**
 * In-memory repository for caption jobs.
 *
 * <p>Bounded by size and age; finished jobs disappear after {@code jobstore.expireAfterMinutes}.
 */
@Repository
public class JobRepository {

  private final Cache<String, CaptionJob> cache;

  public JobRepository(
      @Value("${jobstore.maxSize}") int maxSize,
      @Value("${jobstore.expireAfterMinutes}") int expireAfterMinutes) {

    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(Duration.ofMinutes(expireAfterMinutes))
            .build();
  }

  public void save(CaptionJob job) {
    cache.put(job.getJobId(), job);
  }

  /**
   * Save the job unless one with the same id is already tracked.
   *
   * @return true if the job was stored
   */
  public boolean saveIfAbsent(CaptionJob job) {
    return cache.asMap().putIfAbsent(job.getJobId(), job) == null;
  }

  public Optional<CaptionJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }
}
