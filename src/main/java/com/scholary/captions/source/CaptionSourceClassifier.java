package com.scholary.captions.source;

import java.util.List;
import java.util.Optional;

/** Decides which {@link CaptionSource.Kind} raw caption text is. First match wins. */
public final class CaptionSourceClassifier {

  static final String ASS_MARKER = "[Script Info]";

  private CaptionSourceClassifier() {}

  public static CaptionSource classify(String content) {
    if (content == null || content.isBlank()) {
      return CaptionSource.none();
    }
    if (content.contains(ASS_MARKER)) {
      return new CaptionSource(CaptionSource.Kind.ASS, content, List.of());
    }
    Optional<List<SrtEntry>> srt = SrtCodec.tryParse(content);
    if (srt.isPresent() && !srt.get().isEmpty()) {
      return new CaptionSource(CaptionSource.Kind.SRT, content, srt.get());
    }
    return new CaptionSource(CaptionSource.Kind.PLAIN_TEXT, content, List.of());
  }
}
