package com.scholary.consult.scribe.segment;

import com.scholary.consult.scribe.audio.AudioProperties;
import com.scholary.consult.scribe.audio.LoudnessNormalizer;
import com.scholary.consult.scribe.audio.PcmFormat;
import com.scholary.consult.scribe.audio.Recording;
import com.scholary.consult.scribe.audio.WavCodec;
import com.scholary.consult.scribe.logging.StructuredLogger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Splits long recordings into fixed-length segments.
 *
 * <p>Recordings up to the long-audio threshold (60s by default) become a single implicit segment
 * that reuses the recording bytes. Longer recordings are cut into consecutive, non-overlapping
 * windows (45s by default); the last window takes whatever remains. Each window is re-framed as a
 * WAV file and peak-normalized on its own, so a loud passage in one part of the consultation does
 * not leave the rest too quiet.
 *
 * <p>Windows are cut on exact millisecond boundaries: {@code [0, 45000), [45000, 90000), ...,
 * [n*45000, D)}. Their union is exactly {@code [0, D)}.
 */
@Component
public class AudioSegmenter {

  private static final Logger LOGGER = LoggerFactory.getLogger(AudioSegmenter.class);
  private final StructuredLogger structuredLogger = new StructuredLogger(LOGGER);

  private final long longAudioThresholdMs;
  private final long segmentLengthMs;

  @Autowired
  public AudioSegmenter(AudioProperties properties) {
    this(
        properties.segmentation().longAudioThresholdMs(),
        properties.segmentation().segmentLengthMs());
  }

  public AudioSegmenter(long longAudioThresholdMs, long segmentLengthMs) {
    if (segmentLengthMs <= 0) {
      throw new IllegalArgumentException("Segment length must be positive");
    }
    this.longAudioThresholdMs = longAudioThresholdMs;
    this.segmentLengthMs = segmentLengthMs;
  }

  /**
   * Segment a recording.
   *
   * @param recording the recording to split
   * @return segments in ascending index order
   */
  public List<Segment> segment(Recording recording) {
    if (!requiresSplit(recording.durationMs()) || !recording.normalized()) {
      LOGGER.info(
          "Recording {} is {}ms, transcribing as a single segment",
          recording.id(),
          recording.durationMs());
      return List.of(
          new Segment(
              recording.id(),
              0,
              new TimeRange(0, recording.durationMs()),
              recording.audio(),
              true));
    }

    byte[] pcm = WavCodec.pcmOf(recording.audio());
    List<TimeRange> ranges = planRanges(recording.durationMs());
    List<Segment> segments = new ArrayList<>(ranges.size());

    LOGGER.info(
        "Recording {} is {}ms, splitting into {} segments of up to {}ms",
        recording.id(),
        recording.durationMs(),
        ranges.size(),
        segmentLengthMs);

    for (int index = 0; index < ranges.size(); index++) {
      TimeRange range = ranges.get(index);
      int from = (int) Math.min(pcm.length, PcmFormat.bytesForMillis(range.startMs()));
      int to =
          index == ranges.size() - 1
              ? pcm.length
              : (int) Math.min(pcm.length, PcmFormat.bytesForMillis(range.endMs()));

      byte[] slice = LoudnessNormalizer.normalize(Arrays.copyOfRange(pcm, from, to));
      segments.add(new Segment(recording.id(), index, range, WavCodec.wrap(slice), false));
      structuredLogger.logSegmentPlanned(index, range.startMs(), range.endMs(), slice.length);
    }

    return List.copyOf(segments);
  }

  /**
   * Plan the time ranges for a recording of the given duration.
   *
   * <p>Pure function of the duration; exposed so the boundary arithmetic can be checked without
   * audio.
   *
   * @param durationMs total duration in milliseconds
   * @return one range covering everything for short recordings, otherwise consecutive windows
   */
  public List<TimeRange> planRanges(long durationMs) {
    if (durationMs < 0) {
      throw new IllegalArgumentException("Duration cannot be negative");
    }
    if (!requiresSplit(durationMs)) {
      return List.of(new TimeRange(0, durationMs));
    }

    List<TimeRange> ranges = new ArrayList<>();
    for (long start = 0; start < durationMs; start += segmentLengthMs) {
      ranges.add(new TimeRange(start, Math.min(start + segmentLengthMs, durationMs)));
    }
    return List.copyOf(ranges);
  }

  public boolean requiresSplit(long durationMs) {
    return durationMs > longAudioThresholdMs;
  }
}
