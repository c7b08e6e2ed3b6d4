package com.scholary.captions.fonts;

import java.util.Map;
import java.util.Set;

/**
 * Result of one font scan.
 *
 * @param systemFamilies family names reported by fontconfig
 * @param customFontNames custom font file names without extension
 * @param customFamilies custom font file name (without extension) to its fontconfig family
 */
public record FontSnapshot(
    Set<String> systemFamilies, Set<String> customFontNames, Map<String, String> customFamilies) {

  public FontSnapshot {
    systemFamilies = Set.copyOf(systemFamilies);
    customFontNames = Set.copyOf(customFontNames);
    customFamilies = Map.copyOf(customFamilies);
  }

  public static FontSnapshot empty() {
    return new FontSnapshot(Set.of(), Set.of(), Map.of());
  }
}
