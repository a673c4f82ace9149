package com.scholary.consult.scribe.recognition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * One JSON object from the Google Speech v2 response stream.
 *
 * <p>The service answers with several newline-separated objects; the first usually has an empty
 * {@code result} list.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GoogleSpeechResponse(List<Result> result, Integer resultIndex) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Result(List<Alternative> alternative, @JsonProperty("final") Boolean isFinal) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Alternative(String transcript, Double confidence) {}
}
