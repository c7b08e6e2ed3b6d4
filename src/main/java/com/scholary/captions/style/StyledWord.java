package com.scholary.captions.style;

import com.scholary.captions.transcript.Segment;
import com.scholary.captions.transcript.WordTiming;
import java.util.ArrayList;
import java.util.List;

/** A word after replacement and case transformation, with its timing. */
record StyledWord(String text, double start, double end) {

  /** Transform the words of a segment, dropping those that end up empty. */
  static List<StyledWord> fromSegment(Segment segment, TextTransformer transformer) {
    List<StyledWord> styled = new ArrayList<>();
    for (WordTiming word : segment.words()) {
      String text = transformer.transform(word.word());
      if (!text.isEmpty()) {
        styled.add(new StyledWord(text, word.start(), word.end()));
      }
    }
    return styled;
  }

  static String join(List<StyledWord> words) {
    List<String> texts = new ArrayList<>();
    for (StyledWord word : words) {
      texts.add(word.text());
    }
    return String.join(" ", texts);
  }
}
