package com.scholary.consult.scribe.refinement;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Response body from the {@code generateContent} endpoint. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GeminiResponse(List<Candidate> candidates) {

  /** Text parts of the first candidate, concatenated; empty when there is none. */
  public String firstText() {
    if (candidates == null || candidates.isEmpty()) {
      return "";
    }
    Content content = candidates.get(0).content();
    if (content == null || content.parts() == null) {
      return "";
    }
    return content.parts().stream()
        .map(Part::text)
        .filter(Objects::nonNull)
        .collect(Collectors.joining());
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Candidate(Content content, String finishReason) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Content(List<Part> parts, String role) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Part(String text) {}
}
