package com.scholary.captions.source;

import com.scholary.captions.error.CaptionFormatException;
import com.scholary.captions.error.TranscriptionException;
import com.scholary.captions.media.VideoProbe;
import com.scholary.captions.style.CaptionStyle;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.TranscriptionResult;
import com.scholary.captions.whisper.WhisperException;
import com.scholary.captions.whisper.WhisperService;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a classified {@link CaptionSource} into the transcription model the style handlers read.
 *
 * <ul>
 *   <li>SRT: one segment per block, no word timings
 *   <li>Plain text: one segment covering the whole video
 *   <li>None: transcribe the video with word timings
 * </ul>
 *
 * <p>ASS sources are passed through by the caller and never reach this class.
 */
@Component
public class CaptionSourceNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionSourceNormalizer.class);

  static final double FALLBACK_DURATION_SECONDS = 10.0;

  private final VideoProbe videoProbe;
  private final WhisperService whisperService;

  public CaptionSourceNormalizer(VideoProbe videoProbe, WhisperService whisperService) {
    this.videoProbe = videoProbe;
    this.whisperService = whisperService;
  }

  /**
   * Reject style requests the source cannot support.
   *
   * <p>SRT blocks carry no word timings, so only the classic style can render them.
   *
   * @param source classified source
   * @param requestedStyle style name from the request, before any fallback
   * @throws CaptionFormatException for an SRT source with a non-classic style
   */
  public void requireStyleSupported(CaptionSource source, String requestedStyle) {
    if (source.kind() == CaptionSource.Kind.SRT && !CaptionStyle.isClassic(requestedStyle)) {
      throw new CaptionFormatException("Only 'classic' style is supported for SRT captions.");
    }
  }

  /**
   * Build the transcription for a source.
   *
   * @param source classified source, not ASS
   * @param video downloaded video, used for duration and transcription
   * @param language language hint for transcription, {@code auto} to detect
   * @return segments to render
   * @throws CaptionFormatException if an SRT block has no duration
   * @throws TranscriptionException if transcription fails
   */
  public TranscriptionResult normalize(CaptionSource source, Path video, String language) {
    switch (source.kind()) {
      case SRT:
        return fromSrt(source.srtEntries());
      case PLAIN_TEXT:
        return fromPlainText(source.content(), videoProbe.duration(video));
      case NONE:
        return transcribe(video, language);
      case ASS:
      default:
        throw new IllegalStateException(source.kind() + " captions are not converted");
    }
  }

  static TranscriptionResult fromSrt(List<SrtEntry> entries) {
    List<Segment> segments = new ArrayList<>();
    for (SrtEntry entry : entries) {
      if (entry.end() <= entry.start()) {
        throw new CaptionFormatException(
            String.format(
                "Invalid SRT format: subtitle %d ends at or before its start", entry.index()));
      }
      segments.add(Segment.ofText(entry.start(), entry.end(), entry.text()));
    }
    LOGGER.info("Converted {} SRT blocks to segments", segments.size());
    return TranscriptionResult.of(segments);
  }

  static TranscriptionResult fromPlainText(String text, OptionalDouble videoDuration) {
    double duration;
    if (videoDuration.isPresent() && videoDuration.getAsDouble() > 0) {
      duration = videoDuration.getAsDouble();
    } else {
      duration = FALLBACK_DURATION_SECONDS;
      LOGGER.warn(
          "Video duration not available, using {} seconds as fallback.",
          FALLBACK_DURATION_SECONDS);
    }
    return TranscriptionResult.of(List.of(Segment.ofText(0.0, duration, text.strip())));
  }

  private TranscriptionResult transcribe(Path video, String language) {
    LOGGER.info("No captions provided, generating transcription.");
    try {
      TranscriptionResult result = whisperService.transcribe(video, language);
      LOGGER.info(
          "Transcription produced {} segments, {} words, language={}",
          result.segments().size(),
          result.wordCount(),
          result.language());
      return result;
    } catch (WhisperException e) {
      throw new TranscriptionException("Transcription failed: " + e.getMessage(), e);
    }
  }
}
