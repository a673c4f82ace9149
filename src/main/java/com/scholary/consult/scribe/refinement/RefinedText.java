package com.scholary.consult.scribe.refinement;

/**
 * Transcript text after the improvement pass.
 *
 * @param transcriptId the transcript it came from
 * @param text the corrected text, or the original when improvement was skipped or failed
 * @param refined whether {@code text} came back from the generative service
 */
public record RefinedText(String transcriptId, String text, boolean refined) {}
