package com.scholary.captions.style;

import com.scholary.captions.ass.DialogueEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text pre-processing shared by all style handlers.
 *
 * <p>Replacements run before upper-casing. Line splitting works on the caption's own words, so a
 * replacement never moves text onto another line.
 */
public class TextTransformer {

  private final List<ReplaceRule> replaceRules;
  private final boolean allCaps;

  public TextTransformer(List<ReplaceRule> replaceRules, boolean allCaps) {
    this.replaceRules = List.copyOf(replaceRules);
    this.allCaps = allCaps;
  }

  /** Apply replacements and optional upper-casing. */
  public String transform(String text) {
    String result = text == null ? "" : text;
    for (ReplaceRule rule : replaceRules) {
      result = rule.apply(result);
    }
    if (allCaps) {
      result = result.toUpperCase(Locale.ROOT);
    }
    return result;
  }

  /**
   * Break the text into lines of at most {@code maxWordsPerLine} words, then transform each line.
   *
   * @return lines joined with the ASS line break
   */
  public String splitAndTransform(String text, int maxWordsPerLine) {
    List<String> lines = new ArrayList<>();
    for (String line : splitLines(text, maxWordsPerLine)) {
      lines.add(transform(line));
    }
    return String.join(DialogueEvent.LINE_BREAK, lines);
  }

  /**
   * Split text into lines of at most {@code maxWordsPerLine} whitespace-separated words.
   *
   * <p>With a limit of 0 the text is returned as a single, untouched line.
   */
  public static List<String> splitLines(String text, int maxWordsPerLine) {
    if (maxWordsPerLine <= 0) {
      return List.of(text);
    }
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      return List.of();
    }
    String[] words = trimmed.split("\\s+");
    List<String> lines = new ArrayList<>();
    for (int i = 0; i < words.length; i += maxWordsPerLine) {
      int end = Math.min(i + maxWordsPerLine, words.length);
      lines.add(String.join(" ", List.of(words).subList(i, end)));
    }
    return lines;
  }

  /** Partition items into consecutive groups of {@code groupSize}; 0 means a single group. */
  public static <T> List<List<T>> group(List<T> items, int groupSize) {
    if (groupSize <= 0) {
      return items.isEmpty() ? List.of() : List.of(items);
    }
    List<List<T>> groups = new ArrayList<>();
    for (int i = 0; i < items.size(); i += groupSize) {
      groups.add(items.subList(i, Math.min(i + groupSize, items.size())));
    }
    return groups;
  }
}
