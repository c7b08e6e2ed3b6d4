package com.scholary.captions.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.captions.media.CommandRunner.CommandResult;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

@EnabledOnOs({OS.LINUX, OS.MAC})
class CommandRunnerTest {

  private final CommandRunner runner = new CommandRunner();

  @Test
  void run_shouldCaptureStdoutAndExitCode() throws IOException {
    CommandResult result = runner.run(List.of("sh", "-c", "echo hello"), Duration.ofSeconds(5));

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.stdout()).isEqualTo("hello\n");
  }

  @Test
  void run_shouldCaptureStderrAndFailureCode() throws IOException {
    CommandResult result =
        runner.run(List.of("sh", "-c", "echo oops 1>&2; exit 3"), Duration.ofSeconds(5));

    assertThat(result.exitCode()).isEqualTo(3);
    assertThat(result.stderr()).contains("oops");
  }

  @Test
  void run_shouldFailForUnknownProgram() {
    assertThatThrownBy(
            () -> runner.run(List.of("definitely-not-a-real-tool-xyz"), Duration.ofSeconds(5)))
        .isInstanceOf(IOException.class);
  }
}
