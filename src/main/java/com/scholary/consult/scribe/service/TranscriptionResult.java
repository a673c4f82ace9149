package com.scholary.consult.scribe.service;

import com.scholary.consult.scribe.audio.Recording;
import com.scholary.consult.scribe.refinement.RefinedText;
import com.scholary.consult.scribe.transcript.Transcript;

/**
 * Everything one end-to-end transcription run produced.
 *
 * @param recording the ingested recording
 * @param transcript the stitched transcript
 * @param refined the improved text; when improvement was not requested it holds the transcript
 *     text with {@code refined} false
 */
public record TranscriptionResult(Recording recording, Transcript transcript, RefinedText refined) {

  /** The text to show: improved when available, raw otherwise. */
  public String text() {
    return refined.text();
  }
}
