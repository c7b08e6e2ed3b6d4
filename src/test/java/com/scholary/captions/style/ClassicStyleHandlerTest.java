package com.scholary.captions.style;

import static com.scholary.captions.style.StyleHandlersFixture.CENTER_1080P;
import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.captions.ass.DialogueEvent;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.TranscriptionResult;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ClassicStyleHandlerTest {

  private final ClassicStyleHandler handler = new ClassicStyleHandler();

  @Test
  void render_shouldEmitOneEventPerSegment() {
    TranscriptionResult transcription =
        TranscriptionResult.of(
            List.of(
                Segment.ofText(0.0, 2.0, " first\nline "), Segment.ofText(2.0, 4.5, "second")));

    List<DialogueEvent> events = handler.render(transcription, StyleHandlersFixture.context(null));

    assertThat(events).hasSize(2);
    assertThat(events.get(0).toAssLine())
        .isEqualTo(
            "Dialogue: 0,0:00:00.00,0:00:02.00,Default,,0,0,0,," + CENTER_1080P + "first line");
    assertThat(events.get(1).start()).isEqualTo(2.0);
    assertThat(events.get(1).end()).isEqualTo(4.5);
  }

  @Test
  void render_shouldSplitLinesBeforeCapsAndReplacements() {
    StyleContext context =
        StyleContext.of(
            StyleOptionsNormalizer.normalize(Map.of("all_caps", true, "max_words_per_line", 2)),
            List.of(new ReplaceRule("u", "you guys")),
            1920,
            1080);
    TranscriptionResult transcription =
        TranscriptionResult.of(List.of(Segment.ofText(0.0, 1.0, "see u at home")));

    List<DialogueEvent> events = handler.render(transcription, context);

    assertThat(events.get(0).text()).isEqualTo("SEE YOU GUYS\\NAT HOME");
  }

  @Test
  void render_shouldIgnoreWordTimings() {
    List<DialogueEvent> events =
        handler.render(StyleHandlersFixture.threeWords(), StyleHandlersFixture.context(null));

    assertThat(events).hasSize(1);
    assertThat(events.get(0).text()).isEqualTo("hello big world");
    assertThat(events.get(0).colorOverride()).isEmpty();
  }
}
