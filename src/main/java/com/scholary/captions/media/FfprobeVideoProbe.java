package com.scholary.captions.media;

import com.scholary.captions.media.CommandRunner.CommandResult;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link VideoProbe} backed by ffprobe.
 *
 * <p>Probe failures are never fatal: resolution falls back to 384x288 and duration to empty, and
 * callers decide what to do with a missing duration.
 */
@Component
public class FfprobeVideoProbe implements VideoProbe {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfprobeVideoProbe.class);

  // ffprobe -of csv=s=x:p=0 prints e.g. "1920x1080"
  private static final Pattern RESOLUTION_PATTERN = Pattern.compile("(\\d+)x(\\d+)");

  private final CommandRunner commandRunner;
  private final ProbeProperties properties;

  public FfprobeVideoProbe(CommandRunner commandRunner, ProbeProperties properties) {
    this.commandRunner = commandRunner;
    this.properties = properties;
  }

  @Override
  public VideoResolution resolution(Path video) {
    List<String> command =
        List.of(
            properties.binary(),
            "-v",
            "error",
            "-select_streams",
            "v:0",
            "-show_entries",
            "stream=width,height",
            "-of",
            "csv=s=x:p=0",
            video.toString());
    try {
      CommandResult result = commandRunner.run(command, timeout());
      if (result.isSuccess()) {
        Optional<VideoResolution> resolution = parseResolution(result.stdout());
        if (resolution.isPresent()) {
          LOGGER.info("Video resolution determined: {}", resolution.get());
          return resolution.get();
        }
      }
      LOGGER.warn(
          "No video stream found in {}. Using default resolution {}.",
          video,
          VideoResolution.DEFAULT);
    } catch (IOException e) {
      LOGGER.error(
          "Error getting video resolution: {}. Using default resolution {}.",
          e.getMessage(),
          VideoResolution.DEFAULT);
    }
    return VideoResolution.DEFAULT;
  }

  @Override
  public OptionalDouble duration(Path video) {
    List<String> command =
        List.of(
            properties.binary(),
            "-v",
            "error",
            "-show_entries",
            "format=duration",
            "-of",
            "default=noprint_wrappers=1:nokey=1",
            video.toString());
    try {
      CommandResult result = commandRunner.run(command, timeout());
      if (result.isSuccess()) {
        return parseDuration(result.stdout());
      }
      LOGGER.warn("ffprobe could not read duration of {}", video);
    } catch (IOException e) {
      LOGGER.warn("Could not determine video duration: {}", e.getMessage());
    }
    return OptionalDouble.empty();
  }

  static Optional<VideoResolution> parseResolution(String output) {
    for (String line : output.split("\\R")) {
      Matcher matcher = RESOLUTION_PATTERN.matcher(line.trim());
      if (matcher.find()) {
        int width = Integer.parseInt(matcher.group(1));
        int height = Integer.parseInt(matcher.group(2));
        if (width > 0 && height > 0) {
          return Optional.of(new VideoResolution(width, height));
        }
      }
    }
    return Optional.empty();
  }

  static OptionalDouble parseDuration(String output) {
    String trimmed = output.trim();
    if (trimmed.isEmpty()) {
      return OptionalDouble.empty();
    }
    try {
      double seconds = Double.parseDouble(trimmed.split("\\R")[0].trim());
      return Double.isFinite(seconds) ? OptionalDouble.of(seconds) : OptionalDouble.empty();
    } catch (NumberFormatException e) {
      LOGGER.warn("Unexpected ffprobe duration output: {}", trimmed);
      return OptionalDouble.empty();
    }
  }

  private Duration timeout() {
    return Duration.ofSeconds(properties.timeoutSeconds());
  }
}
