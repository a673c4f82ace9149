package com.scholary.consult.scribe.refinement;

import com.scholary.consult.scribe.transcript.FailureMarkers;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Improves and summarizes transcript text through the generative-text service.
 *
 * <p>Text that is blank or is itself a recognition failure marker is never sent, and neither is
 * anything while the service is unavailable: both operations hand the input back unchanged. A
 * stitched transcript with some failed segments is still sent whole. An improvement failure also
 * hands the input back, while a summary failure is raised as {@link SummarizationException}.
 */
@Service
public class RefinementOrchestrator {

  private static final Logger LOGGER = LoggerFactory.getLogger(RefinementOrchestrator.class);

  private final GenerativeTextService generativeTextService;
  private final PromptTemplates promptTemplates;
  private final Clock clock;

  public RefinementOrchestrator(
      GenerativeTextService generativeTextService, PromptTemplates promptTemplates, Clock clock) {
    this.generativeTextService = generativeTextService;
    this.promptTemplates = promptTemplates;
    this.clock = clock;
  }

  /**
   * Correct grammar, punctuation and structure while keeping clinical terms.
   *
   * @param transcriptId id of the transcript the text came from
   * @param text the raw transcript text
   * @return the improved text, or the original when improvement was skipped or failed
   */
  public RefinedText improve(String transcriptId, String text) {
    if (shouldPassThrough(text, "improve")) {
      return new RefinedText(transcriptId, text, false);
    }

    try {
      String improved = generativeTextService.generate(promptTemplates.improvePrompt(text)).strip();
      LOGGER.info(
          "Transcript improved: transcriptId={}, chars={}->{}",
          transcriptId,
          text.length(),
          improved.length());
      return new RefinedText(transcriptId, improved, true);
    } catch (GenerativeServiceException e) {
      LOGGER.warn(
          "Improvement failed, keeping original text: transcriptId={}, error={}",
          transcriptId,
          e.getMessage());
      return new RefinedText(transcriptId, text, false);
    }
  }

  /**
   * Produce a structured summary.
   *
   * @param transcriptId id of the summarized transcript
   * @param text transcript text to summarize
   * @param instruction the caller's own instruction, embedded verbatim; {@code null} or blank
   *     selects the default section layout
   * @return the summary markup, or the input text when summarization was skipped
   * @throws SummarizationException if the service fails
   */
  public Summary summarize(String transcriptId, String text, String instruction) {
    boolean custom = instruction != null && !instruction.isBlank();

    if (shouldPassThrough(text, "summarize")) {
      return new Summary(transcriptId, text, custom, false, clock.instant());
    }

    String prompt =
        custom
            ? promptTemplates.customSummaryPrompt(text, instruction.strip())
            : promptTemplates.defaultSummaryPrompt(text);

    String markup;
    try {
      markup = generativeTextService.generate(prompt);
    } catch (GenerativeServiceException e) {
      LOGGER.error("Summary failed: transcriptId={}, error={}", transcriptId, e.getMessage());
      throw new SummarizationException("Could not generate summary: " + e.getMessage(), e);
    }

    LOGGER.info(
        "Summary generated: transcriptId={}, custom={}, chars={}",
        transcriptId,
        custom,
        markup.length());
    return new Summary(transcriptId, markup, custom, true, clock.instant());
  }

  private boolean shouldPassThrough(String text, String operation) {
    if (text == null || text.isBlank()) {
      LOGGER.debug("Skipping {}: empty text", operation);
      return true;
    }
    if (FailureMarkers.carriesFailure(text)) {
      LOGGER.info("Skipping {}: text is a failure marker", operation);
      return true;
    }
    if (!generativeTextService.isAvailable()) {
      LOGGER.info("Skipping {}: generative service unavailable", operation);
      return true;
    }
    return false;
  }
}
