package com.scholary.captions.style;

import com.scholary.captions.ass.DialogueEvent;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.TranscriptionResult;
import com.scholary.captions.transcript.WordTiming;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Karaoke style: one event per segment where every word carries a {@code \k} tag with its
 * duration in centiseconds, so the renderer sweeps the highlight across the line.
 *
 * <p>Segments without word timings are skipped.
 */
@Component
public class KaraokeStyleHandler implements StyleHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(KaraokeStyleHandler.class);

  @Override
  public List<DialogueEvent> render(TranscriptionResult transcription, StyleContext context) {
    List<DialogueEvent> events = new ArrayList<>();
    String colorOverride = DialogueEvent.colorTag(context.wordColor());

    for (Segment segment : transcription.segments()) {
      if (!segment.hasWords()) {
        continue;
      }
      List<WordTiming> words = segment.words();

      List<String> lines = new ArrayList<>();
      for (List<WordTiming> group : TextTransformer.group(words, context.maxWordsPerLine())) {
        List<String> tokens = new ArrayList<>();
        for (WordTiming word : group) {
          tokens.add(karaokeTag(word) + context.text().transform(word.word()));
        }
        lines.add(String.join(" ", tokens).trim());
      }

      events.add(
          new DialogueEvent(
              0,
              words.get(0).start(),
              words.get(words.size() - 1).end(),
              context.positionTag(),
              colorOverride,
              String.join(DialogueEvent.LINE_BREAK, lines)));
    }
    LOGGER.debug("Rendered {} karaoke dialogues at {}", events.size(), context.placement());
    return events;
  }

  /** {@code {\k<cs>}} where cs is the word duration in centiseconds, ties rounded to even. */
  static String karaokeTag(WordTiming word) {
    return "{\\k" + (long) Math.rint(word.duration() * 100) + "}";
  }

  @Override
  public CaptionStyle getStyle() {
    return CaptionStyle.KARAOKE;
  }
}
