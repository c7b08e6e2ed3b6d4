package com.scholary.captions.style;

import com.scholary.captions.ass.DialogueEvent;
import com.scholary.captions.transcript.TranscriptionResult;
import java.util.List;

/**
 * Renders a transcription into dialogue events for one {@link CaptionStyle}.
 *
 * <p>Events are returned in dialogue order; segments and words are processed in input order.
 */
public interface StyleHandler {

  /**
   * Render dialogue events.
   *
   * @param transcription segments to render
   * @param context options, placement and colors for this request
   * @return events in output order
   */
  List<DialogueEvent> render(TranscriptionResult transcription, StyleContext context);

  /**
   * Get the style this handler renders.
   *
   * @return the style
   */
  CaptionStyle getStyle();
}
