package com.scholary.captions.style;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class TextTransformerTest {

  @Test
  void splitLines_shouldChunkWords() {
    assertThat(TextTransformer.splitLines("a b c d e", 2)).containsExactly("a b", "c d", "e");
  }

  @Test
  void splitLines_shouldKeepTextWhenUnlimited() {
    assertThat(TextTransformer.splitLines("a  b c", 0)).containsExactly("a  b c");
  }

  @Test
  void splitLines_shouldReturnNothingForBlankText() {
    assertThat(TextTransformer.splitLines("   ", 3)).isEmpty();
  }

  @Test
  void transform_shouldReplaceBeforeUpperCasing() {
    TextTransformer transformer =
        new TextTransformer(List.of(new ReplaceRule("colour", "color")), true);

    assertThat(transformer.transform("Colour me")).isEqualTo("COLOR ME");
  }

  @Test
  void splitAndTransform_shouldJoinLinesWithAssBreak() {
    TextTransformer transformer = new TextTransformer(List.of(), false);

    assertThat(transformer.splitAndTransform("one two three", 2)).isEqualTo("one two\\Nthree");
  }

  @Test
  void splitAndTransform_shouldSplitBeforeReplacing() {
    TextTransformer transformer =
        new TextTransformer(List.of(new ReplaceRule("u", "you guys")), false);

    assertThat(transformer.splitAndTransform("see u at home", 2))
        .isEqualTo("see you guys\\Nat home");
  }

  @Test
  void group_shouldPartitionAndTreatZeroAsSingleGroup() {
    List<Integer> items = List.of(1, 2, 3, 4, 5);

    assertThat(TextTransformer.group(items, 2))
        .containsExactly(List.of(1, 2), List.of(3, 4), List.of(5));
    assertThat(TextTransformer.group(items, 0)).containsExactly(items);
    assertThat(TextTransformer.group(List.of(), 0)).isEmpty();
  }
}
