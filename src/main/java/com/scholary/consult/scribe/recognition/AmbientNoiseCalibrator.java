package com.scholary.consult.scribe.recognition;

import com.scholary.consult.scribe.audio.LoudnessNormalizer;
import java.util.Arrays;

/**
 * Measures ambient noise from the lead-in of a recording.
 *
 * <p>The first {@code calibrationMillis} of audio are treated as background: their energy is
 * measured buffer by buffer and folded into a damped energy threshold, and the lead-in itself is
 * consumed so it is not sent to the recognizer.
 */
public class AmbientNoiseCalibrator {

  static final double INITIAL_THRESHOLD = 300.0;
  static final double ENERGY_RATIO = 1.5;
  static final double DAMPING = 0.15;
  static final int BUFFER_MILLIS = 64;

  private final int calibrationMillis;

  public AmbientNoiseCalibrator(int calibrationMillis) {
    if (calibrationMillis <= 0) {
      throw new IllegalArgumentException("Calibration window must be positive");
    }
    this.calibrationMillis = calibrationMillis;
  }

  /**
   * Calibrate against the lead-in and return the remaining audio.
   *
   * @param pcm PCM16LE mono samples
   * @param sampleRate their sample rate
   * @param readLevel level name carried into the result
   * @throws AudioReadException if nothing would remain after the lead-in
   */
  public PreparedAudio calibrate(byte[] pcm, int sampleRate, String readLevel) {
    int bytesPerMilli = sampleRate * 2 / 1000;
    int windowBytes = alignToFrame(calibrationMillis * bytesPerMilli);
    if (pcm.length <= windowBytes) {
      throw new AudioReadException(
          String.format(
              "Audio too short for %dms noise calibration: %d bytes",
              calibrationMillis, pcm.length));
    }

    int bufferBytes = alignToFrame(BUFFER_MILLIS * bytesPerMilli);
    double secondsPerBuffer = BUFFER_MILLIS / 1000.0;
    double damping = Math.pow(DAMPING, secondsPerBuffer);

    double threshold = INITIAL_THRESHOLD;
    for (int offset = 0; offset < windowBytes; offset += bufferBytes) {
      int length = Math.min(bufferBytes, windowBytes - offset);
      double energy = LoudnessNormalizer.rms(pcm, offset, length);
      threshold = threshold * damping + energy * ENERGY_RATIO * (1 - damping);
    }

    return new PreparedAudio(
        Arrays.copyOfRange(pcm, windowBytes, pcm.length), sampleRate, readLevel, threshold);
  }

  public int calibrationMillis() {
    return calibrationMillis;
  }

  private static int alignToFrame(int bytes) {
    return bytes / 2 * 2;
  }
}
