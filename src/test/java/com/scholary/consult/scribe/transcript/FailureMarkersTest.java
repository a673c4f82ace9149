package com.scholary.consult.scribe.transcript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class FailureMarkersTest {

  @Test
  void markerFor_shouldKeepServiceErrorOnOneBracketedLine() {
    String marker =
        FailureMarkers.markerFor(
            TranscriptFragment.serviceError(0, "status 500:\n[internal] failure", true));

    assertThat(marker)
        .isEqualTo("[Erro no serviço de reconhecimento: status 500: [internal) failure]")
        .doesNotContain("\n");
  }

  @Test
  void markerFor_shouldDistinguishWholeAndSegmentSilence() {
    assertThat(FailureMarkers.markerFor(TranscriptFragment.empty(0, true)))
        .isEqualTo("[Áudio vazio ou muito baixo]");
    assertThat(FailureMarkers.markerFor(TranscriptFragment.empty(3, false)))
        .isEqualTo("[Segmento silencioso]");
  }

  @Test
  void markerFor_shouldRejectSuccessfulFragment() {
    assertThatThrownBy(() -> FailureMarkers.markerFor(TranscriptFragment.ok(0, "x", true)))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void carriesFailure_shouldDetectLeadingMarker() {
    assertThat(FailureMarkers.carriesFailure("[Áudio vazio ou muito baixo]")).isTrue();
    assertThat(FailureMarkers.carriesFailure("  [Erro no serviço de reconhecimento: x]")).isTrue();
  }

  @Test
  void carriesFailure_shouldIgnoreFailedSegmentInsideStitchedText() {
    String stitched = "### Segment 1\nbom dia\n\n### Segment 2\n[Segmento silencioso]";

    assertThat(FailureMarkers.carriesFailure(stitched)).isFalse();
  }

  @Test
  void carriesFailure_shouldAcceptOrdinaryText() {
    assertThat(FailureMarkers.carriesFailure("### Segment 1\nbom dia\n\n### Segment 2\ntudo bem"))
        .isFalse();
    assertThat(FailureMarkers.carriesFailure("Paciente relata dor [leve] no joelho")).isFalse();
    assertThat(FailureMarkers.carriesFailure(null)).isFalse();
  }
}
