package com.scholary.consult.scribe.export;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for exported documents.
 *
 * <p>{@code zoneId} and {@code timestampPattern} format the "Generated on" line and the archive
 * header.
 */
@ConfigurationProperties(prefix = "export")
@Validated
public record ExportProperties(@NotBlank String zoneId, @NotBlank String timestampPattern) {}
