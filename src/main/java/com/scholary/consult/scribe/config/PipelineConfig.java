package com.scholary.consult.scribe.config;

import com.scholary.consult.scribe.service.PipelineProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Enables the PipelineProperties to be loaded from application.yml. */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {}
