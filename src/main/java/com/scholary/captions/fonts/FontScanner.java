package com.scholary.captions.fonts;

/** Enumerates installed and custom fonts. */
public interface FontScanner {

  /**
   * Scan fonts. Tool failures are not errors; they yield fewer fonts.
   *
   * @return the fonts found
   */
  FontSnapshot scan();
}
