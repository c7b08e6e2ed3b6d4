package com.scholary.captions.api;

import com.scholary.captions.fonts.FontCatalog;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/** Lists the fonts captions can use. */
@RestController
@Tag(name = "Fonts", description = "Installed font catalog")
public class FontController {

  private static final Logger LOGGER = LoggerFactory.getLogger(FontController.class);

  private final FontCatalog fontCatalog;

  public FontController(FontCatalog fontCatalog) {
    this.fontCatalog = fontCatalog;
  }

  @GetMapping("/api/fonts")
  @Operation(summary = "List fonts", description = "Sorted names accepted as font_family")
  public ResponseEntity<List<String>> listFonts() {
    return ResponseEntity.ok(fontCatalog.availableFontNames());
  }

  @PostMapping("/api/fonts/refresh")
  @Operation(
      summary = "Rescan fonts",
      description = "Drop the cached catalog and scan system and custom fonts again")
  public ResponseEntity<List<String>> refreshFonts() {
    fontCatalog.invalidate();
    List<String> fonts = fontCatalog.availableFontNames();
    LOGGER.info("Font catalog refreshed: {} fonts", fonts.size());
    return ResponseEntity.ok(fonts);
  }
}
