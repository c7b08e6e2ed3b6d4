package com.scholary.captions.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.captions.config.CaptionProperties;
import com.scholary.captions.error.PersistenceException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CaptionWriterTest {

  @TempDir Path tempDir;

  private CaptionWriter writerFor(Path outputDir) {
    return new CaptionWriter(
        new CaptionProperties(outputDir.toString(), tempDir.toString(), "auto", 1, 1));
  }

  @Test
  void write_shouldCreateAssFileNamedAfterJob() throws IOException {
    Path outputDir = tempDir.resolve("out");

    Path written = writerFor(outputDir).write("job-42", "[Script Info]\n");

    assertThat(written).isEqualTo(outputDir.resolve("job-42.ass"));
    assertThat(Files.readString(written)).isEqualTo("[Script Info]\n");
    try (Stream<Path> files = Files.list(outputDir)) {
      assertThat(files).containsExactly(written);
    }
  }

  @Test
  void write_shouldReplaceExistingFile() throws IOException {
    CaptionWriter writer = writerFor(tempDir);
    writer.write("job", "old");

    Path written = writer.write("job", "new");

    assertThat(Files.readString(written)).isEqualTo("new");
  }

  @Test
  void write_shouldReportUnwritableOutputDir() throws IOException {
    Path blocker = Files.writeString(tempDir.resolve("not-a-dir"), "x");

    assertThatThrownBy(() -> writerFor(blocker).write("job", "content"))
        .isInstanceOf(PersistenceException.class)
        .hasMessageStartingWith("Failed to write caption file:");
  }
}
