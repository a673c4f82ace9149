package com.scholary.consult.scribe.audio;

/**
 * Converts arbitrary input audio into the canonical format.
 *
 * <p>Implementations decode whatever container/codec the browser or upload produced and return a
 * WAV file in {@link PcmFormat}, peak-normalized.
 */
public interface AudioNormalizer {

  /**
   * Normalize audio bytes.
   *
   * @param rawAudio the input bytes, in any format the decoder understands
   * @return canonical WAV bytes
   * @throws DecodeException if the input is too small or cannot be decoded
   */
  byte[] normalize(byte[] rawAudio);
}
