package com.scholary.consult.scribe.config;

import com.scholary.consult.scribe.audio.AudioNormalizer;
import com.scholary.consult.scribe.recognition.AmbientNoiseCalibrator;
import com.scholary.consult.scribe.recognition.ConvertingReadStrategy;
import com.scholary.consult.scribe.recognition.DirectReadStrategy;
import com.scholary.consult.scribe.recognition.FallbackAudioReader;
import com.scholary.consult.scribe.recognition.RecognitionProperties;
import java.util.List;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for speech recognition.
 *
 * <p>The read chain order matters: the converting level is tried first, then a direct read with
 * calibration, then a direct read without it.
 */
@Configuration
@EnableConfigurationProperties(RecognitionProperties.class)
public class RecognitionConfig {

  @Bean
  public AmbientNoiseCalibrator ambientNoiseCalibrator(RecognitionProperties properties) {
    return new AmbientNoiseCalibrator(properties.calibrationMillis());
  }

  @Bean
  public FallbackAudioReader fallbackAudioReader(
      AudioNormalizer audioNormalizer, AmbientNoiseCalibrator calibrator) {
    return new FallbackAudioReader(
        List.of(
            new ConvertingReadStrategy(audioNormalizer, calibrator),
            new DirectReadStrategy("direct", calibrator),
            new DirectReadStrategy("direct-uncalibrated", null)));
  }
}
