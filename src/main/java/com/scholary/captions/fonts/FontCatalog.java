package com.scholary.captions.fonts;

import com.scholary.captions.error.FontUnavailableException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Process-wide catalog of fonts usable in captions.
 *
 * <p>The scan runs once, on first use, and the result is reused by every request. Fonts installed
 * afterwards are not seen until {@link #invalidate()} is called.
 */
@Component
public class FontCatalog {

  private static final Logger LOGGER = LoggerFactory.getLogger(FontCatalog.class);

  private static final List<String> ARIAL_STYLE_ALIASES = List.of("ARIALBD", "ARIALI", "ARIALBI");

  private final FontScanner scanner;
  private final Object lock = new Object();
  private volatile FontSnapshot snapshot;

  public FontCatalog(FontScanner scanner) {
    this.scanner = scanner;
  }

  /**
   * All names accepted as {@code font_family}: fontconfig families plus custom font file names.
   *
   * @return sorted font names
   */
  public List<String> availableFontNames() {
    FontSnapshot fonts = snapshot();
    Set<String> names = new TreeSet<>();
    names.addAll(fonts.systemFamilies());
    names.addAll(fonts.customFontNames());
    if (names.stream().anyMatch(name -> name.equalsIgnoreCase("arial"))) {
      names.addAll(ARIAL_STYLE_ALIASES);
    }
    return new ArrayList<>(names);
  }

  /**
   * Fail unless the font is available.
   *
   * @throws FontUnavailableException carrying every available name
   */
  public void requireAvailable(String fontFamily) {
    List<String> available = availableFontNames();
    for (String name : available) {
      if (name.equalsIgnoreCase(fontFamily)) {
        return;
      }
    }
    LOGGER.warn("Font '{}' not available ({} fonts known)", fontFamily, available.size());
    throw new FontUnavailableException(fontFamily, available);
  }

  /**
   * Name to write into the ASS style line.
   *
   * <p>Custom font file names map to their fontconfig family. The result never contains a comma,
   * since commas separate fields in the style line.
   */
  public String resolveAssFamily(String fontFamily) {
    for (Map.Entry<String, String> entry : snapshot().customFamilies().entrySet()) {
      if (entry.getKey().equalsIgnoreCase(fontFamily)) {
        return firstSegment(entry.getValue(), fontFamily);
      }
    }
    return firstSegment(fontFamily, fontFamily);
  }

  /** Drop the cached scan; the next lookup rescans. */
  public void invalidate() {
    synchronized (lock) {
      snapshot = null;
    }
    LOGGER.info("Font catalog invalidated");
  }

  private FontSnapshot snapshot() {
    FontSnapshot current = snapshot;
    if (current != null) {
      return current;
    }
    synchronized (lock) {
      if (snapshot == null) {
        snapshot = scanner.scan();
        LOGGER.info(
            "Font catalog loaded: {} system families, {} custom fonts",
            snapshot.systemFamilies().size(),
            snapshot.customFontNames().size());
      }
      return snapshot;
    }
  }

  private static String firstSegment(String name, String fallback) {
    if (name == null) {
      return fallback;
    }
    String first = name.split(",", -1)[0].trim();
    return first.isEmpty() ? fallback : first;
  }
}
