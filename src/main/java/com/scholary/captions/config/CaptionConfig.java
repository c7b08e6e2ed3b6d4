package com.scholary.captions.config;

import com.scholary.captions.fonts.FontProperties;
import com.scholary.captions.media.DownloaderProperties;
import com.scholary.captions.media.ProbeProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for caption generation beans.
 *
 * <p>Enables the caption, font, ffprobe and downloader properties to be loaded from
 * application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  CaptionProperties.class,
  FontProperties.class,
  ProbeProperties.class,
  DownloaderProperties.class
})
public class CaptionConfig {}
