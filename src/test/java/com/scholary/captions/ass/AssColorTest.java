package com.scholary.captions.ass;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AssColorTest {

  @Test
  void fromRgb_shouldSwapToBlueGreenRed() {
    assertThat(AssColor.fromRgb("#FF0000")).isEqualTo("&H000000FF");
    assertThat(AssColor.fromRgb("#123456")).isEqualTo("&H00563412");
  }

  @Test
  void fromRgb_shouldAcceptMissingHashAndLowerCase() {
    assertThat(AssColor.fromRgb("ffff00")).isEqualTo("&H0000FFFF");
  }

  @Test
  void fromRgb_shouldFallBackToWhiteForMalformedInput() {
    assertThat(AssColor.fromRgb("red")).isEqualTo(AssColor.WHITE);
    assertThat(AssColor.fromRgb("#FFF")).isEqualTo(AssColor.WHITE);
    assertThat(AssColor.fromRgb(null)).isEqualTo(AssColor.WHITE);
  }
}
