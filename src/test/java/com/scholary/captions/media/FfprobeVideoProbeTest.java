package com.scholary.captions.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

import com.scholary.captions.media.CommandRunner.CommandResult;
import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FfprobeVideoProbeTest {

  private static final Path VIDEO = Path.of("clip.mp4");

  @Mock private CommandRunner commandRunner;

  private FfprobeVideoProbe probe;

  @BeforeEach
  void setUp() {
    probe = new FfprobeVideoProbe(commandRunner, new ProbeProperties("ffprobe", 5));
  }

  @Test
  void parseResolution_shouldReadWidthByHeight() {
    assertThat(FfprobeVideoProbe.parseResolution("1920x1080\n"))
        .hasValue(new VideoResolution(1920, 1080));
    assertThat(FfprobeVideoProbe.parseResolution("")).isEmpty();
  }

  @Test
  void parseDuration_shouldReadFirstLine() {
    assertThat(FfprobeVideoProbe.parseDuration("12.345000\n")).hasValue(12.345);
    assertThat(FfprobeVideoProbe.parseDuration("N/A\n")).isEmpty();
  }

  @Test
  void resolution_shouldUseProbeOutput() throws IOException {
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenReturn(new CommandResult(0, "1280x720\n", ""));

    assertThat(probe.resolution(VIDEO)).isEqualTo(new VideoResolution(1280, 720));
  }

  @Test
  void resolution_shouldFallBackToDefaultWhenProbeFails() throws IOException {
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenThrow(new IOException("ffprobe timed out after 5s"));

    assertThat(probe.resolution(VIDEO)).isEqualTo(VideoResolution.DEFAULT);
  }

  @Test
  void resolution_shouldFallBackToDefaultWithoutVideoStream() throws IOException {
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenReturn(new CommandResult(0, "", ""));

    assertThat(probe.resolution(VIDEO)).isEqualTo(new VideoResolution(384, 288));
  }

  @Test
  void duration_shouldBeEmptyOnNonZeroExit() throws IOException {
    when(commandRunner.run(anyList(), any(Duration.class)))
        .thenReturn(new CommandResult(1, "", "Invalid data found"));

    assertThat(probe.duration(VIDEO)).isEqualTo(OptionalDouble.empty());
  }
}
