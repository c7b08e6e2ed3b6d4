package com.scholary.captions.style;

import com.scholary.captions.ass.AlignmentResolver;
import com.scholary.captions.ass.AssColor;
import com.scholary.captions.ass.Placement;
import java.util.List;

/**
 * Everything a {@link StyleHandler} needs for one request.
 *
 * <p>Placement is resolved once; every event of the run shares it.
 *
 * @param options typed style options
 * @param text text pre-processing for this request
 * @param placement anchor and position shared by all events
 * @param lineColor ASS color for base text
 * @param wordColor ASS color for the active word
 */
public record StyleContext(
    StyleOptions options,
    TextTransformer text,
    Placement placement,
    String lineColor,
    String wordColor) {

  public static StyleContext of(
      StyleOptions options, List<ReplaceRule> replaceRules, int videoWidth, int videoHeight) {
    Placement placement =
        AlignmentResolver.resolve(
            options.position(),
            options.alignment(),
            options.x(),
            options.y(),
            videoWidth,
            videoHeight);
    return new StyleContext(
        options,
        new TextTransformer(replaceRules, options.allCaps()),
        placement,
        AssColor.fromRgb(options.lineColor()),
        AssColor.fromRgb(options.wordColor()));
  }

  public int maxWordsPerLine() {
    return options.maxWordsPerLine();
  }

  public String positionTag() {
    return placement.positionTag();
  }
}
