package com.scholary.consult.scribe.audio;

import javax.sound.sampled.AudioFormat;

/**
 * Canonical audio format used throughout the pipeline.
 *
 * <p>16 kHz, 16-bit signed PCM, mono, little-endian. Recordings and segments carry this format
 * framed as a WAV file.
 */
public final class PcmFormat {

  public static final int SAMPLE_RATE = 16_000;
  public static final int BITS_PER_SAMPLE = 16;
  public static final int CHANNELS = 1;
  public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS;
  public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;

  /** Java Sound description of the canonical format. */
  public static final AudioFormat JAVA_SOUND_FORMAT =
      new AudioFormat(SAMPLE_RATE, BITS_PER_SAMPLE, CHANNELS, true, false);

  private PcmFormat() {}

  /** Number of PCM bytes covering the given duration, aligned to whole frames. */
  public static long bytesForMillis(long millis) {
    return millis * BYTE_RATE / 1000 / BLOCK_ALIGN * BLOCK_ALIGN;
  }

  /** Duration of a PCM payload in milliseconds. */
  public static long millisForBytes(long bytes) {
    return bytes * 1000 / BYTE_RATE;
  }
}
