package com.scholary.captions.style;

import com.scholary.captions.ass.DialogueEvent;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.TranscriptionResult;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Word-by-word style: one event per word showing only that word in the word color.
 *
 * <p>{@code max_words_per_line} has no visible effect here since every event holds a single word.
 */
@Component
public class WordByWordStyleHandler implements StyleHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(WordByWordStyleHandler.class);

  @Override
  public List<DialogueEvent> render(TranscriptionResult transcription, StyleContext context) {
    List<DialogueEvent> events = new ArrayList<>();
    String wordTag = DialogueEvent.colorTag(context.wordColor());

    for (Segment segment : transcription.segments()) {
      for (StyledWord word : StyledWord.fromSegment(segment, context.text())) {
        events.add(
            new DialogueEvent(
                0, word.start(), word.end(), context.positionTag(), wordTag, word.text()));
      }
    }
    LOGGER.debug("Rendered {} word-by-word dialogues at {}", events.size(), context.placement());
    return events;
  }

  @Override
  public CaptionStyle getStyle() {
    return CaptionStyle.WORD_BY_WORD;
  }
}
