package com.scholary.consult.scribe.config;

import com.scholary.consult.scribe.export.ExportProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the ExportProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(ExportProperties.class)
public class ExportConfig {}
