package com.scholary.consult.scribe.refinement;

import java.util.List;

/** Request body for the {@code generateContent} endpoint. */
public record GeminiRequest(List<Content> contents) {

  public static GeminiRequest ofPrompt(String prompt) {
    return new GeminiRequest(List.of(new Content("user", List.of(new Part(prompt)))));
  }

  public record Content(String role, List<Part> parts) {}

  public record Part(String text) {}
}
