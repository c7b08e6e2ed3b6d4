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
 * Classic style: one event per segment spanning the segment, text in the style's primary color.
 *
 * <p>Works with or without word timings, which makes it the only style available for SRT and
 * plain text sources.
 */
@Component
public class ClassicStyleHandler implements StyleHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClassicStyleHandler.class);

  @Override
  public List<DialogueEvent> render(TranscriptionResult transcription, StyleContext context) {
    List<DialogueEvent> events = new ArrayList<>();
    for (Segment segment : transcription.segments()) {
      String text = segment.text().trim().replace('\n', ' ');
      events.add(
          new DialogueEvent(
              0,
              segment.start(),
              segment.end(),
              context.positionTag(),
              "",
              context.text().splitAndTransform(text, context.maxWordsPerLine())));
    }
    LOGGER.debug("Rendered {} classic dialogues at {}", events.size(), context.placement());
    return events;
  }

  @Override
  public CaptionStyle getStyle() {
    return CaptionStyle.CLASSIC;
  }
}
