package com.scholary.consult.scribe.recognition;

import com.scholary.consult.scribe.audio.AudioNormalizer;
import com.scholary.consult.scribe.audio.DecodeException;
import com.scholary.consult.scribe.audio.PcmFormat;
import com.scholary.consult.scribe.audio.WavCodec;
import com.scholary.consult.scribe.segment.Segment;

/**
 * Preferred read level: run the bytes through the normalizer, then calibrate.
 *
 * <p>Handles any container the decoder understands and guarantees the canonical sample format.
 */
public class ConvertingReadStrategy implements AudioReadStrategy {

  private final AudioNormalizer normalizer;
  private final AmbientNoiseCalibrator calibrator;

  public ConvertingReadStrategy(AudioNormalizer normalizer, AmbientNoiseCalibrator calibrator) {
    this.normalizer = normalizer;
    this.calibrator = calibrator;
  }

  @Override
  public String name() {
    return "converted";
  }

  @Override
  public PreparedAudio read(Segment segment) {
    byte[] pcm;
    try {
      pcm = WavCodec.pcmOf(normalizer.normalize(segment.audio()));
    } catch (DecodeException | IllegalArgumentException e) {
      throw new AudioReadException("Conversion failed: " + e.getMessage(), e);
    }
    return calibrator.calibrate(pcm, PcmFormat.SAMPLE_RATE, name());
  }
}
