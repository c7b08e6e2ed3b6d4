package com.scholary.captions.style;

import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Rendering styles for dialogue events. */
public enum CaptionStyle {
  /** One event per segment, plain text. */
  CLASSIC("classic"),

  /** One event per segment with {@code \k} timing per word. */
  KARAOKE("karaoke"),

  /** Persistent line plus a recolored overlay per spoken word. */
  HIGHLIGHT("highlight"),

  /** One event per word with the current word underlined. */
  UNDERLINE("underline"),

  /** One event per word showing only that word. */
  WORD_BY_WORD("word_by_word");

  private static final Logger LOGGER = LoggerFactory.getLogger(CaptionStyle.class);

  private final String styleName;

  CaptionStyle(String styleName) {
    this.styleName = styleName;
  }

  public String getStyleName() {
    return styleName;
  }

  /**
   * Look up a style by request name.
   *
   * <p>Matching ignores case and accepts hyphens for underscores. Unknown or missing names fall
   * back to {@link #CLASSIC} with a warning.
   */
  public static CaptionStyle resolve(String name) {
    if (name == null || name.isBlank()) {
      return CLASSIC;
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    for (CaptionStyle style : values()) {
      if (style.styleName.equals(normalized)) {
        return style;
      }
    }
    LOGGER.warn("Unknown style '{}'; defaulting to 'classic'.", name);
    return CLASSIC;
  }

  /** Whether the name resolves to classic without falling back. */
  public static boolean isClassic(String name) {
    return name == null
        || name.isBlank()
        || CLASSIC.styleName.equals(name.trim().toLowerCase(Locale.ROOT));
  }
}
