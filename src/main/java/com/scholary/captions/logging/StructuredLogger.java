package com.scholary.captions.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method logs one caption pipeline event with an {@code event_type} field and event
 * specific fields that can be queried in Kibana. Event fields are removed again after the log call;
 * job fields stay until {@link #clearJobContext()}.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log caption job started event. */
  public void logCaptionStarted(String videoUrl, boolean captionsSupplied, int excludeRanges) {
    try {
      MDC.put("event_type", "caption_started");
      MDC.put("captionsSupplied", String.valueOf(captionsSupplied));
      MDC.put("excludeRanges", String.valueOf(excludeRanges));

      logger.info(
          "Caption started: videoUrl={}, captionsSupplied={}, excludeRanges={}",
          videoUrl,
          captionsSupplied,
          excludeRanges);
    } finally {
      clearEventFields();
    }
  }

  /** Log caption source classification. */
  public void logSourceDetected(String sourceKind, int videoWidth, int videoHeight) {
    try {
      MDC.put("event_type", "source_detected");
      MDC.put("sourceKind", sourceKind);
      MDC.put("videoWidth", String.valueOf(videoWidth));
      MDC.put("videoHeight", String.valueOf(videoHeight));

      logger.info(
          "Source detected: kind={}, resolution={}x{}", sourceKind, videoWidth, videoHeight);
    } finally {
      clearEventFields();
    }
  }

  /** Log dialogue rendering event. */
  public void logStyleRendered(String style, int segments, int dialogueEvents) {
    try {
      MDC.put("event_type", "style_rendered");
      MDC.put("style", style);
      MDC.put("segments", String.valueOf(segments));
      MDC.put("dialogueEvents", String.valueOf(dialogueEvents));

      logger.info(
          "Style rendered: style={}, segments={}, dialogueEvents={}",
          style,
          segments,
          dialogueEvents);
    } finally {
      clearEventFields();
    }
  }

  /** Log time range exclusion event. */
  public void logRangesExcluded(int ranges, int linesBefore, int linesAfter) {
    try {
      MDC.put("event_type", "ranges_excluded");
      MDC.put("ranges", String.valueOf(ranges));
      MDC.put("linesRemoved", String.valueOf(linesBefore - linesAfter));

      logger.info(
          "Ranges excluded: ranges={}, lines={} -> {}", ranges, linesBefore, linesAfter);
    } finally {
      clearEventFields();
    }
  }

  /** Log caption job finished event. */
  public void logCaptionFinished(String outputPath, long durationMs) {
    try {
      MDC.put("event_type", "caption_finished");
      MDC.put("outputPath", outputPath);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.info("Caption finished: output={}, duration={}ms", outputPath, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log caption job failure event. */
  public void logCaptionFailed(String errorKind, String message, long durationMs) {
    try {
      MDC.put("event_type", "caption_failed");
      MDC.put("errorKind", errorKind);
      MDC.put("durationMs", String.valueOf(durationMs));

      logger.error(
          "Caption failed: kind={}, message={}, duration={}ms", errorKind, message, durationMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, String style) {
    MDC.put("jobId", jobId);
    MDC.put("requestedStyle", style);
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("requestedStyle");
  }

  /** Clear event-specific fields from MDC. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("captionsSupplied");
    MDC.remove("excludeRanges");
    MDC.remove("sourceKind");
    MDC.remove("videoWidth");
    MDC.remove("videoHeight");
    MDC.remove("style");
    MDC.remove("segments");
    MDC.remove("dialogueEvents");
    MDC.remove("ranges");
    MDC.remove("linesRemoved");
    MDC.remove("outputPath");
    MDC.remove("durationMs");
    MDC.remove("errorKind");
  }
}
