package com.scholary.captions.style;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.captions.error.ValidationException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReplaceRuleTest {

  @Test
  void apply_shouldReplaceCaseInsensitively() {
    ReplaceRule rule = new ReplaceRule("gonna", "going to");

    assertThat(rule.apply("Gonna do it, GONNA win")).isEqualTo("going to do it, going to win");
  }

  @Test
  void apply_shouldTreatFindAndReplaceLiterally() {
    ReplaceRule rule = new ReplaceRule("$5.00", "$1 off");

    assertThat(rule.apply("only $5.00 today")).isEqualTo("only $1 off today");
  }

  @Test
  void constructor_shouldRejectEmptyFind() {
    assertThatThrownBy(() -> new ReplaceRule("", "x"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void parseAll_shouldReturnEmptyForNull() {
    assertThat(ReplaceRule.parseAll(null)).isEmpty();
  }

  @Test
  void parseAll_shouldRejectNonList() {
    assertThatThrownBy(() -> ReplaceRule.parseAll(Map.of("find", "a", "replace", "b")))
        .isInstanceOf(ValidationException.class)
        .hasMessage("'replace' should be a list of objects with 'find' and 'replace' keys.");
  }

  @Test
  void parseAll_shouldSkipInvalidItems() {
    List<ReplaceRule> rules =
        ReplaceRule.parseAll(
            List.of(
                "not an object",
                Map.of("find", "a"),
                Map.of("find", "", "replace", "b"),
                Map.of("find", "cat", "replace", "dog")));

    assertThat(rules).containsExactly(new ReplaceRule("cat", "dog"));
  }

  @Test
  void parseAll_shouldLetLaterDuplicateWin() {
    List<ReplaceRule> rules =
        ReplaceRule.parseAll(
            List.of(
                Map.of("find", "a", "replace", "1"),
                Map.of("find", "b", "replace", "2"),
                Map.of("find", "a", "replace", "3")));

    assertThat(rules).containsExactly(new ReplaceRule("a", "3"), new ReplaceRule("b", "2"));
  }
}
