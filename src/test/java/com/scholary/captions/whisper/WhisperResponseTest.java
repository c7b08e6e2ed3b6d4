package com.scholary.captions.whisper;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.captions.transcript.TranscriptionResult;
import com.scholary.captions.transcript.WordTiming;
import org.junit.jupiter.api.Test;

class WhisperResponseTest {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void toTranscriptionResult_shouldTrimWordsAndKeepLanguage() throws Exception {
    String json =
        "{\"language\":\"en\",\"duration\":3.0,"
            + "\"segments\":[{\"id\":0,\"start\":0.0,\"end\":1.5,"
            + "\"text\":\" Hello there\","
            + "\"words\":[{\"word\":\" Hello\",\"start\":0.0,\"end\":0.7},"
            + "{\"word\":\" there\",\"start\":0.7,\"end\":1.5,\"probability\":0.9}]}]}";

    TranscriptionResult result =
        objectMapper.readValue(json, WhisperResponse.class).toTranscriptionResult();

    assertThat(result.language()).isEqualTo("en");
    assertThat(result.segments()).hasSize(1);
    assertThat(result.segments().get(0).words())
        .containsExactly(new WordTiming("Hello", 0.0, 0.7), new WordTiming("there", 0.7, 1.5));
  }

  @Test
  void toTranscriptionResult_shouldSkipZeroLengthSegments() throws Exception {
    String json =
        "{\"segments\":[{\"start\":2.0,\"end\":2.0,\"text\":\"blip\"},"
            + "{\"start\":2.0,\"end\":3.0,\"text\":\"ok\"}]}";

    TranscriptionResult result =
        objectMapper.readValue(json, WhisperResponse.class).toTranscriptionResult();

    assertThat(result.segments()).hasSize(1);
    assertThat(result.segments().get(0).text()).isEqualTo("ok");
    assertThat(result.segments().get(0).hasWords()).isFalse();
  }

  @Test
  void toTranscriptionResult_shouldTolerateMissingSegments() {
    assertThat(new WhisperResponse(null, null).toTranscriptionResult().segments()).isEmpty();
  }
}
