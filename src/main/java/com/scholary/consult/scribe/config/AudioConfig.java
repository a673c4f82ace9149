package com.scholary.consult.scribe.config;

import com.scholary.consult.scribe.audio.AudioProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for audio normalization and segmentation.
 *
 * <p>Enables the AudioProperties to be loaded from application.yml.
 */
@Configuration
@EnableConfigurationProperties(AudioProperties.class)
public class AudioConfig {}
