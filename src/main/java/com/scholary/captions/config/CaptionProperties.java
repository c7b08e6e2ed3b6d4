package com.scholary.captions.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for caption generation.
 *
 * <p>{@code outputDir} receives the finished {@code .ass} files; {@code workDir} holds one private
 * directory per job for downloads, removed when the job ends.
 */
@ConfigurationProperties(prefix = "captions")
@Validated
public record CaptionProperties(
    @NotBlank String outputDir,
    @NotBlank String workDir,
    @NotBlank String defaultLanguage,
    @Positive int asyncExecutorThreads,
    @Positive int asyncExecutorQueueSize) {}
