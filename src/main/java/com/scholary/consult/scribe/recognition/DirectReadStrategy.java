package com.scholary.consult.scribe.recognition;

import com.scholary.consult.scribe.audio.PcmFormat;
import com.scholary.consult.scribe.segment.Segment;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;

/**
 * Fallback read level: read the bytes with Java Sound, without the external decoder.
 *
 * <p>Works for WAV, AIFF and AU input. Anything that is not already 16-bit signed little-endian
 * mono is converted through Java Sound's format converters; the sample rate is kept as found and
 * passed on to the recognizer.
 *
 * <p>With a {@code null} calibrator the lead-in is kept and no threshold is measured. That is the
 * last level of the chain, for audio too short to spare a calibration window.
 */
public class DirectReadStrategy implements AudioReadStrategy {

  private final String name;
  private final AmbientNoiseCalibrator calibrator;

  public DirectReadStrategy(String name, AmbientNoiseCalibrator calibrator) {
    this.name = name;
    this.calibrator = calibrator;
  }

  @Override
  public String name() {
    return name;
  }

  @Override
  public PreparedAudio read(Segment segment) {
    byte[] pcm;
    int sampleRate;

    try (AudioInputStream source =
        AudioSystem.getAudioInputStream(
            new BufferedInputStream(new ByteArrayInputStream(segment.audio())))) {
      AudioFormat found = source.getFormat();
      sampleRate = Math.round(found.getSampleRate());
      AudioFormat target =
          new AudioFormat(found.getSampleRate(), PcmFormat.BITS_PER_SAMPLE, 1, true, false);

      if (found.matches(target)) {
        pcm = source.readAllBytes();
      } else {
        try (AudioInputStream converted = AudioSystem.getAudioInputStream(target, source)) {
          pcm = converted.readAllBytes();
        }
      }
    } catch (UnsupportedAudioFileException | IOException | IllegalArgumentException e) {
      throw new AudioReadException("Direct read failed: " + e.getMessage(), e);
    }

    if (pcm.length == 0) {
      throw new AudioReadException("Direct read produced no samples");
    }

    if (calibrator == null) {
      return new PreparedAudio(pcm, sampleRate, name, -1);
    }
    return calibrator.calibrate(pcm, sampleRate, name);
  }
}
