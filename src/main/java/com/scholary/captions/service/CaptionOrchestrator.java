package com.scholary.captions.service;

import com.scholary.captions.api.CaptionRequest;
import com.scholary.captions.ass.AssHeaderBuilder;
import com.scholary.captions.ass.DialogueEvent;
import com.scholary.captions.config.CaptionProperties;
import com.scholary.captions.error.CaptionError;
import com.scholary.captions.error.CaptionException;
import com.scholary.captions.error.ErrorKind;
import com.scholary.captions.error.PersistenceException;
import com.scholary.captions.error.SourceRetrievalException;
import com.scholary.captions.error.ValidationException;
import com.scholary.captions.filter.ExcludeRange;
import com.scholary.captions.filter.ExclusionFilter;
import com.scholary.captions.filter.SubtitleKind;
import com.scholary.captions.fonts.FontCatalog;
import com.scholary.captions.logging.StructuredLogger;
import com.scholary.captions.media.MediaDownloader;
import com.scholary.captions.media.VideoProbe;
import com.scholary.captions.media.VideoResolution;
import com.scholary.captions.objectstore.CaptionPublisher;
import com.scholary.captions.objectstore.ObjectStoreException;
import com.scholary.captions.source.CaptionSource;
import com.scholary.captions.source.CaptionSourceClassifier;
import com.scholary.captions.source.CaptionSourceNormalizer;
import com.scholary.captions.style.CaptionStyle;
import com.scholary.captions.style.ReplaceRule;
import com.scholary.captions.style.StyleContext;
import com.scholary.captions.style.StyleHandlerRegistry;
import com.scholary.captions.style.StyleOptions;
import com.scholary.captions.style.StyleOptionsNormalizer;
import com.scholary.captions.transcript.TranscriptionResult;
import java.io.IOException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

/**
 * Runs a caption request end to end.
 *
 * <p>Pipeline:
 *
 * <ol>
 *   <li>Validate exclude ranges, style settings and replace rules
 *   <li>Check the font is installed
 *   <li>Fetch captions given as a URL, download the video into a private work directory
 *   <li>Determine the script resolution
 *   <li>Classify the captions once (ASS, SRT, plain text or none) and build the script
 *   <li>Drop dialogue overlapping excluded ranges
 *   <li>Write {@code <jobId>.ass}, optionally publish it
 * </ol>
 *
 * <p>Any failure stops the pipeline and is returned as one {@link CaptionError}; nothing is
 * written to the output directory for a failed job. The job directory is removed either way.
 */
@Service
public class CaptionOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionOrchestrator.class);

  // Job ids become file names
  private static final Pattern JOB_ID_PATTERN =
      Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]{0,127}$");

  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final CaptionProperties properties;
  private final FontCatalog fontCatalog;
  private final MediaDownloader mediaDownloader;
  private final VideoProbe videoProbe;
  private final CaptionSourceNormalizer sourceNormalizer;
  private final StyleHandlerRegistry styleHandlers;
  private final AssHeaderBuilder headerBuilder;
  private final CaptionWriter captionWriter;
  private final Optional<CaptionPublisher> captionPublisher;

  public CaptionOrchestrator(
      CaptionProperties properties,
      FontCatalog fontCatalog,
      MediaDownloader mediaDownloader,
      VideoProbe videoProbe,
      CaptionSourceNormalizer sourceNormalizer,
      StyleHandlerRegistry styleHandlers,
      AssHeaderBuilder headerBuilder,
      CaptionWriter captionWriter,
      Optional<CaptionPublisher> captionPublisher) {
    this.properties = properties;
    this.fontCatalog = fontCatalog;
    this.mediaDownloader = mediaDownloader;
    this.videoProbe = videoProbe;
    this.sourceNormalizer = sourceNormalizer;
    this.styleHandlers = styleHandlers;
    this.headerBuilder = headerBuilder;
    this.captionWriter = captionWriter;
    this.captionPublisher = captionPublisher;
  }

  /**
   * Generate captions for a request.
   *
   * @param request the caption request
   * @param jobId job id, used as output file name and work directory prefix
   * @return the written file, or the single error that stopped the job
   */
  public CaptionOutcome generate(CaptionRequest request, String jobId) {
    long startTime = System.currentTimeMillis();
    StructuredLogger.setJobContext(jobId, requestedStyleName(request.settings()));
    Path jobDir = null;

    try {
      if (!JOB_ID_PATTERN.matcher(jobId).matches()) {
        throw new ValidationException("Invalid job id: " + jobId);
      }

      List<ExcludeRange> excludeRanges =
          ExclusionFilter.normalizeExcludeRanges(request.excludeTimeRanges());
      StyleOptions options = StyleOptionsNormalizer.normalize(request.settings());
      List<ReplaceRule> replaceRules = ReplaceRule.parseAll(request.replace());

      structuredLogger.logCaptionStarted(
          request.videoUrl(), request.captions() != null, excludeRanges.size());

      if (request.publish() && captionPublisher.isEmpty()) {
        throw new ValidationException(
            "Publishing was requested but object storage is not configured.");
      }

      fontCatalog.requireAvailable(options.fontFamily());
      LOGGER.info("Font '{}' is available.", options.fontFamily());

      String captionsContent = resolveCaptions(request.captions());

      // Private per run, even when two requests share a job id
      Path workRoot = Files.createDirectories(Paths.get(properties.workDir()));
      jobDir = Files.createTempDirectory(workRoot, jobId + "-");
      Path video = downloadVideo(request.videoUrl(), jobDir);
      VideoResolution resolution = resolveResolution(request, video);

      CaptionSource source = CaptionSourceClassifier.classify(captionsContent);
      structuredLogger.logSourceDetected(
          source.kind().name(), resolution.width(), resolution.height());

      String script = buildScript(source, options, replaceRules, resolution, video, request);

      if (!excludeRanges.isEmpty()) {
        int linesBefore = countLines(script);
        script = ExclusionFilter.filter(script, excludeRanges, SubtitleKind.ASS);
        structuredLogger.logRangesExcluded(
            excludeRanges.size(), linesBefore, countLines(script));
      }

      Path output = captionWriter.write(jobId, script);
      String outputUrl = request.publish() ? publish(output) : null;

      structuredLogger.logCaptionFinished(
          output.toString(), System.currentTimeMillis() - startTime);
      return CaptionOutcome.success(jobId, output, outputUrl);

    } catch (CaptionException e) {
      return fail(jobId, e.toError(), startTime, e);
    } catch (IOException e) {
      CaptionError error =
          CaptionError.of(
              ErrorKind.PERSISTENCE, "Failed to prepare job directory: " + e.getMessage());
      return fail(jobId, error, startTime, e);
    } catch (RuntimeException e) {
      CaptionError error =
          CaptionError.of(ErrorKind.INTERNAL, "Unexpected error: " + e.getMessage());
      return fail(jobId, error, startTime, e);
    } finally {
      cleanUp(jobDir);
      StructuredLogger.clearJobContext();
    }
  }

  private String buildScript(
      CaptionSource source,
      StyleOptions options,
      List<ReplaceRule> replaceRules,
      VideoResolution resolution,
      Path video,
      CaptionRequest request) {

    if (source.kind() == CaptionSource.Kind.ASS) {
      LOGGER.info("Detected ASS formatted captions; passing through.");
      return source.content();
    }

    sourceNormalizer.requireStyleSupported(source, options.style());

    String language =
        request.language() == null || request.language().isBlank()
            ? properties.defaultLanguage()
            : request.language();
    TranscriptionResult transcription = sourceNormalizer.normalize(source, video, language);

    StyleOptions sized = options.withDefaultFontSize(resolution.height());
    CaptionStyle style = CaptionStyle.resolve(sized.style());
    StyleContext context =
        StyleContext.of(sized, replaceRules, resolution.width(), resolution.height());

    List<DialogueEvent> events = styleHandlers.get(style).render(transcription, context);
    structuredLogger.logStyleRendered(
        style.getStyleName(), transcription.segments().size(), events.size());

    List<String> lines = new ArrayList<>(events.size());
    for (DialogueEvent event : events) {
      lines.add(event.toAssLine());
    }
    return headerBuilder.build(sized, resolution) + String.join("\n", lines) + "\n";
  }

  private String resolveCaptions(String captions) {
    if (captions == null || captions.isBlank()) {
      return null;
    }
    if (!MediaDownloader.isHttpUrl(captions)) {
      LOGGER.info("Captions provided as raw content.");
      return captions;
    }
    try {
      return mediaDownloader.fetchText(captions.trim());
    } catch (IOException e) {
      throw new SourceRetrievalException("Failed to download captions: " + e.getMessage(), e);
    }
  }

  private Path downloadVideo(String videoUrl, Path jobDir) {
    try {
      Path video = mediaDownloader.download(videoUrl, jobDir);
      LOGGER.info("Video downloaded to {}", video);
      return video;
    } catch (IOException e) {
      throw new SourceRetrievalException("Failed to download video: " + e.getMessage(), e);
    }
  }

  private VideoResolution resolveResolution(CaptionRequest request, Path video) {
    if (request.playResX() != null && request.playResY() != null) {
      VideoResolution resolution = new VideoResolution(request.playResX(), request.playResY());
      LOGGER.info("Using provided PlayResX/PlayResY = {}", resolution);
      return resolution;
    }
    VideoResolution resolution = videoProbe.resolution(video);
    LOGGER.info("Video resolution detected = {}", resolution);
    return resolution;
  }

  private String publish(Path output) {
    try {
      URL url = captionPublisher.orElseThrow().publish(output);
      return url.toString();
    } catch (ObjectStoreException e) {
      captionWriter.delete(output);
      throw new PersistenceException("Failed to publish caption file: " + e.getMessage(), e);
    }
  }

  private CaptionOutcome fail(String jobId, CaptionError error, long startTime, Exception cause) {
    long durationMs = System.currentTimeMillis() - startTime;
    structuredLogger.logCaptionFailed(error.kind().name(), error.error(), durationMs);
    if (error.kind() == ErrorKind.INTERNAL || error.kind() == ErrorKind.PERSISTENCE) {
      LOGGER.error("Caption job {} failed", jobId, cause);
    }
    return CaptionOutcome.failure(jobId, error);
  }

  private static void cleanUp(Path jobDir) {
    if (jobDir == null) {
      return;
    }
    try {
      FileSystemUtils.deleteRecursively(jobDir);
    } catch (IOException e) {
      LOGGER.warn("Could not remove job directory {}: {}", jobDir, e.getMessage());
    }
  }

  private static String requestedStyleName(Object settings) {
    if (settings instanceof Map) {
      Object style = ((Map<?, ?>) settings).get("style");
      return style == null ? StyleOptions.DEFAULT_STYLE : String.valueOf(style);
    }
    return StyleOptions.DEFAULT_STYLE;
  }

  private static int countLines(String text) {
    return text.isEmpty() ? 0 : text.split("\\R", -1).length;
  }
}
