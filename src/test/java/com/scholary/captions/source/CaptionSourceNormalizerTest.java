package com.scholary.captions.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.scholary.captions.error.CaptionFormatException;
import com.scholary.captions.error.TranscriptionException;
import com.scholary.captions.media.VideoProbe;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.TranscriptionResult;
import com.scholary.captions.whisper.WhisperException;
import com.scholary.captions.whisper.WhisperService;
import java.nio.file.Path;
import java.util.List;
import java.util.OptionalDouble;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CaptionSourceNormalizerTest {

  private static final Path VIDEO = Path.of("video.mp4");

  @Mock private VideoProbe videoProbe;
  @Mock private WhisperService whisperService;

  private CaptionSourceNormalizer normalizer;

  @BeforeEach
  void setUp() {
    normalizer = new CaptionSourceNormalizer(videoProbe, whisperService);
  }

  @Test
  void requireStyleSupported_shouldRejectNonClassicStyleForSrt() {
    CaptionSource srt = CaptionSourceClassifier.classify("1\n00:00:00,000 --> 00:00:01,000\nHi\n");

    assertThatThrownBy(() -> normalizer.requireStyleSupported(srt, "karaoke"))
        .isInstanceOf(CaptionFormatException.class)
        .hasMessage("Only 'classic' style is supported for SRT captions.");
  }

  @Test
  void requireStyleSupported_shouldAllowAnyStyleForPlainText() {
    CaptionSource text = CaptionSourceClassifier.classify("hello");

    normalizer.requireStyleSupported(text, "karaoke");
  }

  @Test
  void normalize_shouldConvertSrtBlocksToSegments() {
    CaptionSource srt =
        CaptionSourceClassifier.classify(
            "1\n00:00:00,000 --> 00:00:01,000\nOne\n\n2\n00:00:02,000 --> 00:00:03,000\nTwo\n");

    TranscriptionResult result = normalizer.normalize(srt, VIDEO, "auto");

    assertThat(result.segments())
        .containsExactly(Segment.ofText(0.0, 1.0, "One"), Segment.ofText(2.0, 3.0, "Two"));
    verifyNoInteractions(whisperService);
  }

  @Test
  void normalize_shouldRejectSrtBlockWithoutDuration() {
    CaptionSource srt =
        CaptionSourceClassifier.classify("1\n00:00:02,000 --> 00:00:02,000\nStuck\n");

    assertThatThrownBy(() -> normalizer.normalize(srt, VIDEO, "auto"))
        .isInstanceOf(CaptionFormatException.class)
        .hasMessageContaining("subtitle 1");
  }

  @Test
  void normalize_shouldSpanPlainTextOverVideoDuration() {
    when(videoProbe.duration(VIDEO)).thenReturn(OptionalDouble.of(42.5));

    TranscriptionResult result =
        normalizer.normalize(CaptionSourceClassifier.classify(" Hello "), VIDEO, "auto");

    assertThat(result.segments()).containsExactly(Segment.ofText(0.0, 42.5, "Hello"));
  }

  @Test
  void normalize_shouldFallBackToTenSecondsWithoutDuration() {
    when(videoProbe.duration(VIDEO)).thenReturn(OptionalDouble.empty());

    TranscriptionResult result =
        normalizer.normalize(CaptionSourceClassifier.classify("Hello"), VIDEO, "auto");

    assertThat(result.segments().get(0).end()).isEqualTo(10.0);
  }

  @Test
  void normalize_shouldTranscribeWhenNoCaptionsGiven() {
    TranscriptionResult transcription =
        TranscriptionResult.of(List.of(Segment.ofText(0.0, 1.0, "spoken")));
    when(whisperService.transcribe(VIDEO, "en")).thenReturn(transcription);

    assertThat(normalizer.normalize(CaptionSource.none(), VIDEO, "en")).isSameAs(transcription);
  }

  @Test
  void normalize_shouldReportTranscriptionFailure() {
    when(whisperService.transcribe(VIDEO, "auto")).thenThrow(new WhisperException("boom", 3, null));

    assertThatThrownBy(() -> normalizer.normalize(CaptionSource.none(), VIDEO, "auto"))
        .isInstanceOf(TranscriptionException.class)
        .hasMessage("Transcription failed: boom");
  }
}
