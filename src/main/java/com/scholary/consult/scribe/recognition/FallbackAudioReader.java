package com.scholary.consult.scribe.recognition;

import com.scholary.consult.scribe.logging.StructuredLogger;
import com.scholary.consult.scribe.segment.Segment;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tries read strategies in order until one succeeds.
 *
 * <p>Default chain (see {@code RecognitionConfig}): converted -> direct -> direct-uncalibrated.
 */
public class FallbackAudioReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(FallbackAudioReader.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final List<AudioReadStrategy> chain;

  public FallbackAudioReader(List<AudioReadStrategy> chain) {
    if (chain.isEmpty()) {
      throw new IllegalArgumentException("Fallback chain needs at least one strategy");
    }
    this.chain = List.copyOf(chain);
  }

  /**
   * Read a segment through the chain.
   *
   * @param segment the segment to read
   * @return audio from the first strategy that succeeded
   * @throws AudioReadException carrying the last strategy's diagnostic if all of them fail
   */
  public PreparedAudio read(Segment segment) {
    AudioReadException lastFailure = null;

    for (AudioReadStrategy strategy : chain) {
      try {
        PreparedAudio audio = strategy.read(segment);
        LOGGER.debug(
            "Read segment {} via {}: bytes={}, rate={}",
            segment.index(),
            strategy.name(),
            audio.pcm().length,
            audio.sampleRate());
        return audio;
      } catch (AudioReadException e) {
        lastFailure = e;
        structuredLogger.logReadFallback(segment.index(), strategy.name(), e.getMessage());
      }
    }

    throw new AudioReadException(
        "Audio could not be read; the format may not be supported. Details: "
            + lastFailure.getMessage(),
        lastFailure);
  }

  public List<String> levels() {
    return chain.stream().map(AudioReadStrategy::name).toList();
  }
}
