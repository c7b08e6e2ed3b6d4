package com.scholary.captions.service;

import com.scholary.captions.config.CaptionProperties;
import com.scholary.captions.error.PersistenceException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes finished caption scripts to the output directory.
 *
 * <p>The script goes to a temp file first and is moved to {@code <jobId>.ass} in one step, so a
 * reader never sees a half-written file and a failed write leaves nothing behind.
 */
@Component
public class CaptionWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionWriter.class);

  static final String EXTENSION = ".ass";

  private final Path outputDir;

  public CaptionWriter(CaptionProperties properties) {
    this.outputDir = Paths.get(properties.outputDir());
  }

  /**
   * Write the script.
   *
   * @param jobId job id, used as file name
   * @param content complete ASS script
   * @return path of the written file
   * @throws PersistenceException if the file cannot be written
   */
  public Path write(String jobId, String content) {
    Path target = outputDir.resolve(jobId + EXTENSION);
    Path temp = null;
    try {
      Files.createDirectories(outputDir);
      temp = Files.createTempFile(outputDir, jobId + "-", ".tmp");
      Files.writeString(temp, content, StandardCharsets.UTF_8);
      try {
        Files.move(
            temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
      } catch (AtomicMoveNotSupportedException e) {
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
      }
      LOGGER.info("Caption file written: {} ({} chars)", target, content.length());
      return target;
    } catch (IOException e) {
      delete(temp);
      throw new PersistenceException("Failed to write caption file: " + e.getMessage(), e);
    }
  }

  /** Remove a file written for a job that failed afterwards. Missing files are ignored. */
  public void delete(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
      LOGGER.info("Caption file removed: {}", file);
    } catch (IOException e) {
      LOGGER.warn("Could not remove caption file {}: {}", file, e.getMessage());
    }
  }
}
