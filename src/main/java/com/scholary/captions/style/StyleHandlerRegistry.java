package com.scholary.captions.style;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Maps each {@link CaptionStyle} to its handler. */
@Component
public class StyleHandlerRegistry {

  private final Map<CaptionStyle, StyleHandler> handlers = new EnumMap<>(CaptionStyle.class);

  public StyleHandlerRegistry(List<StyleHandler> styleHandlers) {
    for (StyleHandler handler : styleHandlers) {
      handlers.put(handler.getStyle(), handler);
    }
    for (CaptionStyle style : CaptionStyle.values()) {
      if (!handlers.containsKey(style)) {
        throw new IllegalStateException("No style handler registered for " + style);
      }
    }
  }

  public StyleHandler get(CaptionStyle style) {
    return handlers.get(style);
  }
}
