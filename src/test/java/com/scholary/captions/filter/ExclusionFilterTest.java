package com.scholary.captions.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.captions.error.CaptionFormatException;
import com.scholary.captions.error.ValidationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExclusionFilterTest {

  private static final String HEADER =
      "[Script Info]\nPlayResX: 1920\n\n[Events]\n"
          + "Format: Layer, Start, End, Style, Name, MarginL, MarginR, MarginV, Effect, Text\n";

  private static final String FIRST =
      "Dialogue: 0,0:00:00.00,0:00:05.00,Default,,0,0,0,,{\\an5\\pos(960,540)}Hello, world";
  private static final String SECOND =
      "Dialogue: 0,0:00:06.00,0:00:08.00,Default,,0,0,0,,{\\an5\\pos(960,540)}Later";

  @Test
  void normalizeExcludeRanges_shouldParseTimeStrings() {
    List<ExcludeRange> ranges =
        ExclusionFilter.normalizeExcludeRanges(
            List.of(Map.of("start", "00:00:02.000", "end", "00:00:03.500")));

    assertThat(ranges).containsExactly(new ExcludeRange(2.0, 3.5));
  }

  @Test
  void normalizeExcludeRanges_shouldReturnEmptyForNull() {
    assertThat(ExclusionFilter.normalizeExcludeRanges(null)).isEmpty();
  }

  @Test
  void normalizeExcludeRanges_shouldRejectNonStringTimes() {
    assertThatThrownBy(
            () -> ExclusionFilter.normalizeExcludeRanges(List.of(Map.of("start", 1, "end", 2))))
        .isInstanceOf(ValidationException.class)
        .hasMessage("exclude_time_ranges start/end must be strings in hh:mm:ss.ms format.");
  }

  @Test
  void normalizeExcludeRanges_shouldRejectInvertedRange() {
    assertThatThrownBy(
            () ->
                ExclusionFilter.normalizeExcludeRanges(
                    List.of(Map.of("start", "00:00:05.000", "end", "00:00:05.000"))))
        .isInstanceOf(ValidationException.class)
        .hasMessage("exclude_time_ranges end must be strictly greater than start.");
  }

  @Test
  void normalizeExcludeRanges_shouldRejectNegativeTimes() {
    assertThatThrownBy(
            () ->
                ExclusionFilter.normalizeExcludeRanges(
                    List.of(Map.of("start", "-1", "end", "00:00:05.000"))))
        .isInstanceOf(ValidationException.class)
        .hasMessage("exclude_time_ranges start/end must be non-negative.");
  }

  @Test
  void normalizeExcludeRanges_shouldRejectNonListValue() {
    assertThatThrownBy(() -> ExclusionFilter.normalizeExcludeRanges("00:00:01-00:00:02"))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void filter_shouldDropOverlappingDialogueAndKeepEverythingElse() {
    String script = HEADER + FIRST + "\n" + SECOND + "\n";

    String filtered =
        ExclusionFilter.filter(script, List.of(new ExcludeRange(2.0, 3.0)), SubtitleKind.ASS);

    assertThat(filtered).isEqualTo(HEADER + SECOND + "\n");
  }

  @Test
  void filter_shouldKeepDialogueOnlyTouchingRange() {
    String script = HEADER + FIRST + "\n";

    String filtered =
        ExclusionFilter.filter(script, List.of(new ExcludeRange(5.0, 6.0)), SubtitleKind.ASS);

    assertThat(filtered).isEqualTo(script);
  }

  @Test
  void filter_shouldReturnContentUntouchedWithoutRanges() {
    assertThat(ExclusionFilter.filter("anything", List.of(), SubtitleKind.SRT))
        .isEqualTo("anything");
  }

  @Test
  void filter_shouldRenumberRemainingSrtBlocks() {
    String srt =
        "1\n00:00:00,000 --> 00:00:01,000\nOne\n\n"
            + "2\n00:00:02,000 --> 00:00:03,000\nTwo\n\n"
            + "3\n00:00:04,000 --> 00:00:05,000\nThree\n";

    String filtered =
        ExclusionFilter.filter(srt, List.of(new ExcludeRange(1.5, 3.5)), SubtitleKind.SRT);

    assertThat(filtered)
        .isEqualTo(
            "1\n00:00:00,000 --> 00:00:01,000\nOne\n\n"
                + "2\n00:00:04,000 --> 00:00:05,000\nThree\n\n");
  }

  @Test
  void filter_shouldRejectMalformedSrt() {
    assertThatThrownBy(
            () ->
                ExclusionFilter.filter(
                    "not srt", List.of(new ExcludeRange(0.0, 1.0)), SubtitleKind.SRT))
        .isInstanceOf(CaptionFormatException.class);
  }
}
