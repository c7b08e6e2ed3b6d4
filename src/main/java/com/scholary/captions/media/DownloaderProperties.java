package com.scholary.captions.media;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Timeouts for fetching videos and caption files over HTTP. */
@ConfigurationProperties(prefix = "downloader")
@Validated
public record DownloaderProperties(@Positive int connectTimeout, @Positive int readTimeout) {}
