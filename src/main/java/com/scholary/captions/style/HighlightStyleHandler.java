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
 * Highlight style: two layers per line group.
 *
 * <p>Layer 0 holds the whole group in the line color for the group's span. Layer 1 adds one event
 * per word, scoped to that word, re-rendering the group with only the spoken word in the word
 * color. Event order is group base line first, then its word overlays.
 */
@Component
public class HighlightStyleHandler implements StyleHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(HighlightStyleHandler.class);

  @Override
  public List<DialogueEvent> render(TranscriptionResult transcription, StyleContext context) {
    List<DialogueEvent> events = new ArrayList<>();
    String lineTag = DialogueEvent.colorTag(context.lineColor());
    String wordTag = DialogueEvent.colorTag(context.wordColor());

    for (Segment segment : transcription.segments()) {
      List<StyledWord> words = StyledWord.fromSegment(segment, context.text());
      if (words.isEmpty()) {
        continue;
      }

      for (List<StyledWord> group : TextTransformer.group(words, context.maxWordsPerLine())) {
        events.add(
            new DialogueEvent(
                0,
                group.get(0).start(),
                group.get(group.size() - 1).end(),
                context.positionTag(),
                lineTag,
                StyledWord.join(group)));

        for (int current = 0; current < group.size(); current++) {
          List<String> parts = new ArrayList<>();
          for (int i = 0; i < group.size(); i++) {
            String text = group.get(i).text();
            parts.add(i == current ? wordTag + text + lineTag : text);
          }
          StyledWord spoken = group.get(current);
          events.add(
              new DialogueEvent(
                  1,
                  spoken.start(),
                  spoken.end(),
                  context.positionTag(),
                  lineTag,
                  String.join(" ", parts)));
        }
      }
    }
    LOGGER.debug("Rendered {} highlight dialogues at {}", events.size(), context.placement());
    return events;
  }

  @Override
  public CaptionStyle getStyle() {
    return CaptionStyle.HIGHLIGHT;
  }
}
