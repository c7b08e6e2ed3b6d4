package com.scholary.captions.media;

/** Script resolution in pixels, used for PlayResX/PlayResY and grid placement. */
public record VideoResolution(int width, int height) {

  /** Fallback when the video cannot be probed. */
  public static final VideoResolution DEFAULT = new VideoResolution(384, 288);

  public VideoResolution {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException(
          "Resolution must be positive, got " + width + "x" + height);
    }
  }

  @Override
  public String toString() {
    return width + "x" + height;
  }
}
