package com.scholary.captions.source;

import java.util.List;

/**
 * Caption input after classification.
 *
 * <p>Resolved once per request; later stages switch on {@link #kind()} and never inspect the raw
 * text again.
 *
 * @param kind detected format
 * @param content raw text, null for {@link Kind#NONE}
 * @param srtEntries parsed blocks for {@link Kind#SRT}, empty otherwise
 */
public record CaptionSource(Kind kind, String content, List<SrtEntry> srtEntries) {

  /** Caption formats accepted as input. */
  public enum Kind {
    /** Complete ASS script, passed through. */
    ASS,
    /** SubRip blocks. */
    SRT,
    /** Free text shown for the whole video. */
    PLAIN_TEXT,
    /** Nothing supplied; transcribe the video. */
    NONE
  }

  public CaptionSource {
    srtEntries = srtEntries == null ? List.of() : List.copyOf(srtEntries);
  }

  public static CaptionSource none() {
    return new CaptionSource(Kind.NONE, null, List.of());
  }
}
