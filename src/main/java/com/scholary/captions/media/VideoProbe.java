package com.scholary.captions.media;

import java.nio.file.Path;
import java.util.OptionalDouble;

/** Reads video metadata needed for caption layout. */
public interface VideoProbe {

  /**
   * Get the size of the first video stream.
   *
   * @param video local video file
   * @return the resolution, or {@link VideoResolution#DEFAULT} if it cannot be determined
   */
  VideoResolution resolution(Path video);

  /**
   * Get the container duration.
   *
   * @param video local video file
   * @return duration in seconds, empty if it cannot be determined
   */
  OptionalDouble duration(Path video);
}
