package com.scholary.captions.media;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Runs external tools (ffprobe, fc-list, fc-query) and collects their standard output.
 *
 * <p>Stderr is read on a separate thread so a chatty tool cannot block on a full pipe. A process
 * that outlives its timeout is destroyed forcibly.
 */
@Component
public class CommandRunner {

  private static final Logger LOGGER = LoggerFactory.getLogger(CommandRunner.class);

  // Tools we call print a few lines; cap to protect memory on unexpected output
  private static final int MAX_OUTPUT_LINES = 10000;

  /** Outcome of a finished command. */
  public record CommandResult(int exitCode, String stdout, String stderr) {

    public boolean isSuccess() {
      return exitCode == 0;
    }
  }

  /**
   * Run a command and wait for it.
   *
   * @param command program and arguments, no shell interpretation
   * @param timeout maximum run time
   * @return exit code and captured output
   * @throws IOException if the process cannot be started, times out or is interrupted
   */
  public CommandResult run(List<String> command, Duration timeout) throws IOException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    Process process = new ProcessBuilder(command).start();
    StringBuilder stderr = new StringBuilder();
    Thread stderrReader =
        new Thread(() -> drain(process, stderr), "stderr-" + command.get(0));
    stderrReader.setDaemon(true);
    stderrReader.start();

    StringBuilder stdout = new StringBuilder();
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
      String line;
      int lines = 0;
      while ((line = reader.readLine()) != null) {
        if (lines++ < MAX_OUTPUT_LINES) {
          stdout.append(line).append('\n');
        }
      }
    }

    try {
      boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
      if (!finished) {
        process.destroyForcibly();
        throw new IOException(command.get(0) + " timed out after " + timeout.toSeconds() + "s");
      }
      stderrReader.join(TimeUnit.SECONDS.toMillis(1));
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new IOException(command.get(0) + " interrupted", e);
    }

    int exitCode = process.exitValue();
    if (exitCode != 0) {
      LOGGER.debug("{} exited with code {}: {}", command.get(0), exitCode, stderr);
    }
    synchronized (stderr) {
      return new CommandResult(exitCode, stdout.toString(), stderr.toString());
    }
  }

  private static void drain(Process process, StringBuilder sink) {
    try (BufferedReader reader =
        new BufferedReader(
            new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        synchronized (sink) {
          if (sink.length() < 8192) {
            sink.append(line).append('\n');
          }
        }
      }
    } catch (IOException e) {
      LOGGER.debug("Stopped reading stderr: {}", e.getMessage());
    }
  }
}
