package com.scholary.captions.fonts;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for font discovery.
 *
 * <p>{@code customDir} holds extra {@code .ttf}/{@code .otf} files; it may not exist, in which
 * case only fontconfig families are offered.
 */
@ConfigurationProperties(prefix = "fonts")
@Validated
public record FontProperties(@NotBlank String customDir, @Positive int queryTimeoutSeconds) {}
