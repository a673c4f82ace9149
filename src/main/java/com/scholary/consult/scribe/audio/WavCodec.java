package com.scholary.consult.scribe.audio;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Frames and unframes canonical PCM payloads as RIFF/WAVE byte arrays.
 *
 * <p>Only the canonical format from {@link PcmFormat} is written. Reading walks the RIFF chunk list
 * so files carrying extra chunks (ffmpeg adds a LIST chunk) are accepted.
 */
public final class WavCodec {

  public static final int HEADER_SIZE = 44;

  private WavCodec() {}

  /**
   * Wrap raw PCM16LE mono 16 kHz samples in a WAV header.
   *
   * @param pcm the raw samples
   * @return a complete WAV file
   */
  public static byte[] wrap(byte[] pcm) {
    Objects.requireNonNull(pcm, "pcm must not be null");
    ByteBuffer buffer =
        ByteBuffer.allocate(HEADER_SIZE + pcm.length).order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(ascii("RIFF"));
    buffer.putInt(36 + pcm.length);
    buffer.put(ascii("WAVE"));
    buffer.put(ascii("fmt "));
    buffer.putInt(16);
    buffer.putShort((short) 1);
    buffer.putShort((short) PcmFormat.CHANNELS);
    buffer.putInt(PcmFormat.SAMPLE_RATE);
    buffer.putInt(PcmFormat.BYTE_RATE);
    buffer.putShort((short) PcmFormat.BLOCK_ALIGN);
    buffer.putShort((short) PcmFormat.BITS_PER_SAMPLE);
    buffer.put(ascii("data"));
    buffer.putInt(pcm.length);
    buffer.put(pcm);
    return buffer.array();
  }

  /**
   * Extract the PCM payload of a canonical WAV file.
   *
   * @param wav the WAV bytes
   * @return the samples of the data chunk
   * @throws IllegalArgumentException if the bytes are not a 16 kHz mono 16-bit PCM WAV file
   */
  public static byte[] pcmOf(byte[] wav) {
    Objects.requireNonNull(wav, "wav must not be null");
    if (wav.length < 12
        || !"RIFF".equals(new String(wav, 0, 4, StandardCharsets.US_ASCII))
        || !"WAVE".equals(new String(wav, 8, 4, StandardCharsets.US_ASCII))) {
      throw new IllegalArgumentException("Not a RIFF/WAVE file");
    }

    ByteBuffer buffer = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);
    int position = 12;
    boolean formatChecked = false;

    while (position + 8 <= wav.length) {
      String chunkId = new String(wav, position, 4, StandardCharsets.US_ASCII);
      int chunkSize = buffer.getInt(position + 4);
      int body = position + 8;

      if ("fmt ".equals(chunkId)) {
        checkFormat(buffer, body);
        formatChecked = true;
      } else if ("data".equals(chunkId)) {
        if (!formatChecked) {
          throw new IllegalArgumentException("WAV data chunk precedes fmt chunk");
        }
        // Streaming writers leave the size unset; take everything that follows.
        int end = chunkSize <= 0 || body + chunkSize > wav.length ? wav.length : body + chunkSize;
        int aligned = body + (end - body) / PcmFormat.BLOCK_ALIGN * PcmFormat.BLOCK_ALIGN;
        return Arrays.copyOfRange(wav, body, aligned);
      }

      if (chunkSize < 0) {
        break;
      }
      position = body + chunkSize + (chunkSize & 1);
    }

    throw new IllegalArgumentException("WAV file has no data chunk");
  }

  /** Duration of a canonical WAV file in milliseconds. */
  public static long durationMillis(byte[] wav) {
    return PcmFormat.millisForBytes(pcmOf(wav).length);
  }

  private static void checkFormat(ByteBuffer buffer, int offset) {
    short audioFormat = buffer.getShort(offset);
    short channels = buffer.getShort(offset + 2);
    int sampleRate = buffer.getInt(offset + 4);
    short bitsPerSample = buffer.getShort(offset + 14);

    if (audioFormat != 1
        || channels != PcmFormat.CHANNELS
        || sampleRate != PcmFormat.SAMPLE_RATE
        || bitsPerSample != PcmFormat.BITS_PER_SAMPLE) {
      throw new IllegalArgumentException(
          String.format(
              "Unsupported WAV format: format=%d, channels=%d, rate=%d, bits=%d",
              audioFormat, channels, sampleRate, bitsPerSample));
    }
  }

  private static byte[] ascii(String value) {
    return value.getBytes(StandardCharsets.US_ASCII);
  }
}
