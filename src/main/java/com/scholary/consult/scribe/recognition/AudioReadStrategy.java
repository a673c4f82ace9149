package com.scholary.consult.scribe.recognition;

import com.scholary.consult.scribe.segment.Segment;

/** One level of the audio read fallback chain. */
public interface AudioReadStrategy {

  /** Name for logs. */
  String name();

  /**
   * Read the segment's bytes into samples for the recognizer.
   *
   * @throws AudioReadException if this level cannot read the audio
   */
  PreparedAudio read(Segment segment);
}
