package com.scholary.consult.scribe.audio;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decodes audio with ffmpeg and normalizes it to the canonical format.
 *
 * <p>Browsers record webm/ogg/mp4 depending on the platform, so decoding is delegated to ffmpeg
 * rather than Java Sound. The input is written to a temp file, ffmpeg resamples it to 16 kHz mono
 * 16-bit PCM, and the result is peak-normalized in memory.
 *
 * <p>Both temp files are deleted on every exit path.
 */
@Component
public class FfmpegAudioNormalizer implements AudioNormalizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioNormalizer.class);

  private final AudioProperties properties;
  private final Path tempDir;

  public FfmpegAudioNormalizer(AudioProperties properties) {
    this.properties = properties;
    this.tempDir = Paths.get(properties.tempDir());

    try {
      Files.createDirectories(this.tempDir);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to create temp directory: " + tempDir, e);
    }
  }

  @Override
  public byte[] normalize(byte[] rawAudio) {
    if (rawAudio == null || rawAudio.length < properties.minInputBytes()) {
      int size = rawAudio == null ? 0 : rawAudio.length;
      throw new DecodeException(
          DecodeException.Reason.TOO_SMALL,
          String.format(
              "Audio is empty or too small: %d bytes (minimum %d)",
              size, properties.minInputBytes()));
    }

    String id = UUID.randomUUID().toString();
    Path input = tempDir.resolve("input_" + id + ".bin");
    Path output = tempDir.resolve("normalized_" + id + ".wav");

    try {
      Files.write(input, rawAudio);
      runFfmpeg(input, output);

      byte[] pcm = WavCodec.pcmOf(Files.readAllBytes(output));
      if (pcm.length == 0) {
        throw new DecodeException(DecodeException.Reason.UNREADABLE, "Decoded audio is empty");
      }

      LOGGER.debug(
          "Normalized audio: inputBytes={}, durationMs={}",
          rawAudio.length,
          PcmFormat.millisForBytes(pcm.length));

      return WavCodec.wrap(LoudnessNormalizer.normalize(pcm));

    } catch (IOException | IllegalArgumentException e) {
      throw new DecodeException(
          DecodeException.Reason.UNREADABLE, "Failed to decode audio: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new DecodeException(DecodeException.Reason.UNREADABLE, "Audio decoding interrupted", e);
    } finally {
      deleteTempFile(input);
      deleteTempFile(output);
    }
  }

  private void runFfmpeg(Path input, Path output) throws IOException, InterruptedException {
    ProcessBuilder pb =
        new ProcessBuilder(
            properties.ffmpegPath(),
            "-hide_banner",
            "-loglevel", "error",
            "-y",
            "-i", input.toString(),
            "-ac", String.valueOf(PcmFormat.CHANNELS),
            "-ar", String.valueOf(PcmFormat.SAMPLE_RATE),
            "-acodec", "pcm_s16le",
            "-f", "wav",
            output.toString());
    pb.redirectErrorStream(true);

    Process process = pb.start();
    boolean finished = process.waitFor(properties.processTimeoutSeconds(), TimeUnit.SECONDS);
    if (!finished) {
      process.destroyForcibly();
      throw new IOException(
          "ffmpeg did not finish within " + properties.processTimeoutSeconds() + "s");
    }

    if (process.exitValue() != 0) {
      String error = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
      throw new IOException("ffmpeg exited with code " + process.exitValue() + ": " + error.trim());
    }
  }

  private void deleteTempFile(Path file) {
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete temp file {}: {}", file, e.getMessage());
    }
  }
}
