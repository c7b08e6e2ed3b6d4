package com.scholary.captions.monitoring;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Generates Kibana Discover URLs for caption job monitoring.
 *
 * <p>Links are pre-filtered on the {@code jobId} MDC field so a caller can jump from a job status
 * response straight to its logs.
 */
@Component
public class KibanaUrlGenerator {

  private final String kibanaBaseUrl;
  private final String indexPattern;

  public KibanaUrlGenerator(
      @Value("${kibana.baseUrl:http://localhost:5601}") String kibanaBaseUrl,
      @Value("${kibana.indexPattern:ass-captions-logs-*}") String indexPattern) {
    this.kibanaBaseUrl = kibanaBaseUrl;
    this.indexPattern = indexPattern;
  }

  /**
   * Generate Kibana Discover URL for a specific job.
   *
   * @param jobId the job ID to filter by
   * @return Kibana URL with pre-filtered query
   */
  public String generateJobUrl(String jobId) {
    // Kibana query: jobId:"abc-123"
    String query = String.format("jobId:\"%s\"", jobId);
    return discoverUrl(query);
  }

  private String discoverUrl(String query) {
    String encodedQuery = URLEncoder.encode(query, StandardCharsets.UTF_8);
    return String.format(
        "%s/app/discover#/?_a=(index:'%s',query:(language:kuery,query:'%s'))",
        kibanaBaseUrl, indexPattern, encodedQuery);
  }
}
