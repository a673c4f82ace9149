package com.scholary.consult.scribe.config;

import com.scholary.consult.scribe.refinement.GenerativeProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the generative-text client.
 *
 * <p>Enables the GenerativeProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(GenerativeProperties.class)
public class GenerativeConfig {}
