package com.scholary.consult.scribe.refinement;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

/**
 * Prompt texts for the improvement and summary calls, loaded once from {@code prompts/} on the
 * classpath.
 *
 * <p>Templates use {@code {{transcript}}} and {@code {{instruction}}} placeholders. Substitution is
 * a plain replace, so the instruction is embedded exactly as the caller wrote it.
 */
@Component
public class PromptTemplates {

  static final String TRANSCRIPT = "{{transcript}}";
  static final String INSTRUCTION = "{{instruction}}";

  private final String improve;
  private final String summaryDefault;
  private final String summaryCustom;

  public PromptTemplates() {
    this.improve = load("prompts/improve.txt");
    this.summaryDefault = load("prompts/summary-default.txt");
    this.summaryCustom = load("prompts/summary-custom.txt");
  }

  public String improvePrompt(String transcript) {
    return improve.replace(TRANSCRIPT, transcript);
  }

  public String defaultSummaryPrompt(String transcript) {
    return summaryDefault.replace(TRANSCRIPT, transcript);
  }

  public String customSummaryPrompt(String transcript, String instruction) {
    // Split on the transcript placeholder first so neither value is scanned for placeholders.
    int at = summaryCustom.indexOf(TRANSCRIPT);
    if (at < 0) {
      return summaryCustom.replace(INSTRUCTION, instruction);
    }
    return summaryCustom.substring(0, at).replace(INSTRUCTION, instruction)
        + transcript
        + summaryCustom.substring(at + TRANSCRIPT.length()).replace(INSTRUCTION, instruction);
  }

  private static String load(String path) {
    try (InputStream in = new ClassPathResource(path).getInputStream()) {
      return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Missing prompt template: " + path, e);
    }
  }
}
