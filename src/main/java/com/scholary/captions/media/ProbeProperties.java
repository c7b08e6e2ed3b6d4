package com.scholary.captions.media;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Configuration for the ffprobe binary. */
@ConfigurationProperties(prefix = "ffprobe")
@Validated
public record ProbeProperties(@NotBlank String binary, @Positive int timeoutSeconds) {}
