package com.scholary.consult.scribe.service;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the consultation pipeline.
 *
 * @param zoneId zone for the timestamp in artifact names
 * @param lockTimeoutSeconds how long a run waits for another run on the same recording
 */
@ConfigurationProperties(prefix = "pipeline")
@Validated
public record PipelineProperties(@NotBlank String zoneId, @Positive long lockTimeoutSeconds) {}
