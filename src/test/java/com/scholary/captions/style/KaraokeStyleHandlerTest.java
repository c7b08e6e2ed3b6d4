package com.scholary.captions.style;

import static com.scholary.captions.style.StyleHandlersFixture.CENTER_1080P;
import static org.assertj.core.api.Assertions.assertThat;

import com.scholary.captions.ass.DialogueEvent;
import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.TranscriptionResult;
import com.scholary.captions.transcript.WordTiming;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class KaraokeStyleHandlerTest {

  private final KaraokeStyleHandler handler = new KaraokeStyleHandler();

  @Test
  void karaokeTag_shouldUseCentiseconds() {
    assertThat(KaraokeStyleHandler.karaokeTag(new WordTiming("hi", 1.0, 1.25)))
        .isEqualTo("{\\k25}");
  }

  @Test
  void karaokeTag_shouldRoundHalfCentisecondsToEven() {
    assertThat(KaraokeStyleHandler.karaokeTag(new WordTiming("a", 1.0, 1.125)))
        .isEqualTo("{\\k12}");
    assertThat(KaraokeStyleHandler.karaokeTag(new WordTiming("b", 1.0, 1.375)))
        .isEqualTo("{\\k38}");
  }

  @Test
  void render_shouldTagEveryWordInOneEvent() {
    List<DialogueEvent> events =
        handler.render(StyleHandlersFixture.threeWords(), StyleHandlersFixture.context(null));

    assertThat(events).hasSize(1);
    assertThat(events.get(0).toAssLine())
        .isEqualTo(
            "Dialogue: 0,0:00:01.00,0:00:02.00,Default,,0,0,0,,"
                + CENTER_1080P
                + "{\\c&H0000FFFF}"
                + "{\\k25}hello {\\k25}big {\\k50}world");
  }

  @Test
  void render_shouldBreakGroupsOntoLines() {
    List<DialogueEvent> events =
        handler.render(
            StyleHandlersFixture.threeWords(),
            StyleHandlersFixture.context(Map.of("max_words_per_line", 2)));

    assertThat(events.get(0).text()).isEqualTo("{\\k25}hello {\\k25}big\\N{\\k50}world");
  }

  @Test
  void render_shouldSkipSegmentsWithoutWords() {
    TranscriptionResult transcription =
        TranscriptionResult.of(List.of(Segment.ofText(0.0, 1.0, "no timings here")));

    assertThat(handler.render(transcription, StyleHandlersFixture.context(null))).isEmpty();
  }
}
