package com.scholary.consult.scribe.refinement;

import java.time.Instant;

/**
 * A structured summary of a transcript, in heading/bold markup.
 *
 * @param transcriptId the summarized transcript
 * @param text the summary markup, or the input text when summarization was skipped
 * @param customInstruction whether the caller supplied the instruction
 * @param generated whether {@code text} came back from the generative service
 * @param createdAt when the summary was produced
 */
public record Summary(
    String transcriptId,
    String text,
    boolean customInstruction,
    boolean generated,
    Instant createdAt) {}
