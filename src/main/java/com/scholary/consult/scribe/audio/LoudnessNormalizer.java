package com.scholary.consult.scribe.audio;

/**
 * Peak normalization for PCM16LE audio.
 *
 * <p>Scales every sample so the loudest one sits just below full scale. Quiet recordings from
 * laptop microphones are the common case, and the recognizer does noticeably better on them once
 * they are brought up to a consistent level.
 */
public final class LoudnessNormalizer {

  /** Headroom left below full scale, in dB. */
  public static final double HEADROOM_DB = 0.1;

  private static final double TARGET_PEAK = Short.MAX_VALUE * Math.pow(10, -HEADROOM_DB / 20);

  private LoudnessNormalizer() {}

  /**
   * Return a peak-normalized copy of the samples.
   *
   * <p>Silent input (every sample zero) is returned unchanged, as a copy.
   *
   * @param pcm PCM16LE samples
   * @return normalized samples, same length as the input
   */
  public static byte[] normalize(byte[] pcm) {
    byte[] result = pcm.clone();
    int peak = peakAmplitude(pcm);
    if (peak == 0) {
      return result;
    }

    double gain = TARGET_PEAK / peak;
    for (int i = 0; i + 1 < result.length; i += 2) {
      int sample = (short) ((result[i] & 0xFF) | (result[i + 1] << 8));
      long scaled = Math.round(sample * gain);
      scaled = Math.max(Short.MIN_VALUE, Math.min(Short.MAX_VALUE, scaled));
      result[i] = (byte) (scaled & 0xFF);
      result[i + 1] = (byte) ((scaled >> 8) & 0xFF);
    }
    return result;
  }

  /** Largest absolute sample value in the buffer. */
  public static int peakAmplitude(byte[] pcm) {
    int peak = 0;
    for (int i = 0; i + 1 < pcm.length; i += 2) {
      int sample = (short) ((pcm[i] & 0xFF) | (pcm[i + 1] << 8));
      peak = Math.max(peak, Math.abs(sample));
    }
    return peak;
  }

  /** Root mean square amplitude of the samples in {@code [offset, offset + length)}. */
  public static double rms(byte[] pcm, int offset, int length) {
    int end = Math.min(pcm.length, offset + length);
    long sumSquares = 0;
    int count = 0;
    for (int i = offset; i + 1 < end; i += 2) {
      int sample = (short) ((pcm[i] & 0xFF) | (pcm[i + 1] << 8));
      sumSquares += (long) sample * sample;
      count++;
    }
    return count == 0 ? 0.0 : Math.sqrt((double) sumSquares / count);
  }
}
