package com.scholary.captions.style;

import com.scholary.captions.ass.DialogueEvent;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.TranscriptionResult;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Underline style: one event per word showing its line group with that word underlined. */
@Component
public class UnderlineStyleHandler implements StyleHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(UnderlineStyleHandler.class);

  private static final String UNDERLINE_ON = "{\\u1}";
  private static final String UNDERLINE_OFF = "{\\u0}";

  @Override
  public List<DialogueEvent> render(TranscriptionResult transcription, StyleContext context) {
    List<DialogueEvent> events = new ArrayList<>();
    String lineTag = DialogueEvent.colorTag(context.lineColor());

    for (Segment segment : transcription.segments()) {
      List<StyledWord> words = StyledWord.fromSegment(segment, context.text());
      if (words.isEmpty()) {
        continue;
      }

      for (List<StyledWord> group : TextTransformer.group(words, context.maxWordsPerLine())) {
        for (int current = 0; current < group.size(); current++) {
          List<String> parts = new ArrayList<>();
          for (int i = 0; i < group.size(); i++) {
            String text = group.get(i).text();
            parts.add(i == current ? UNDERLINE_ON + text + UNDERLINE_OFF : text);
          }
          StyledWord spoken = group.get(current);
          events.add(
              new DialogueEvent(
                  0,
                  spoken.start(),
                  spoken.end(),
                  context.positionTag(),
                  lineTag,
                  String.join(" ", parts)));
        }
      }
    }
    LOGGER.debug("Rendered {} underline dialogues at {}", events.size(), context.placement());
    return events;
  }

  @Override
  public CaptionStyle getStyle() {
    return CaptionStyle.UNDERLINE;
  }
}
