package com.scholary.consult.scribe.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.consult.scribe.TestAudio;
import com.scholary.consult.scribe.audio.AudioNormalizer;
import com.scholary.consult.scribe.audio.DecodeException;
import com.scholary.consult.scribe.audio.Recording;
import com.scholary.consult.scribe.export.ConversationArchiveWriter;
import com.scholary.consult.scribe.export.DocumentExporter;
import com.scholary.consult.scribe.export.ExportFormat;
import com.scholary.consult.scribe.export.ExportProperties;
import com.scholary.consult.scribe.logging.StructuredLogger;
import com.scholary.consult.scribe.recognition.RecognitionClient;
import com.scholary.consult.scribe.refinement.RefinedText;
import com.scholary.consult.scribe.refinement.RefinementOrchestrator;
import com.scholary.consult.scribe.refinement.Summary;
import com.scholary.consult.scribe.segment.AudioSegmenter;
import com.scholary.consult.scribe.segment.Segment;
import com.scholary.consult.scribe.transcript.Transcript;
import com.scholary.consult.scribe.transcript.TranscriptFragment;
import com.scholary.consult.scribe.transcript.TranscriptStitcher;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

@ExtendWith(MockitoExtension.class)
class ConsultationPipelineTest {

  private static final Instant NOW = Instant.parse("2024-03-05T14:30:00Z");

  @Mock private AudioNormalizer audioNormalizer;
  @Mock private RecognitionClient recognitionClient;
  @Mock private RefinementOrchestrator refinementOrchestrator;
  @Mock private DocumentExporter documentExporter;

  private ConsultationPipeline pipeline;

  @BeforeEach
  void setUp() {
    Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    pipeline =
        new ConsultationPipeline(
            audioNormalizer,
            new AudioSegmenter(60_000, 45_000),
            recognitionClient,
            new TranscriptStitcher(),
            refinementOrchestrator,
            documentExporter,
            new ConversationArchiveWriter(
                new ExportProperties("America/Sao_Paulo", "dd/MM/yyyy HH:mm"), clock),
            new RecordingLocks(new PipelineProperties("America/Sao_Paulo", 5)),
            new ArtifactNames(new PipelineProperties("America/Sao_Paulo", 5)),
            clock);
  }

  private static Recording recording(long durationMs) {
    return new Recording(
        "rec-1", "ana", TestAudio.toneWav(durationMs, 3000), durationMs, NOW, null, true);
  }

  @Test
  void ingest_shouldNormalizeAndMeasureDuration() {
    when(audioNormalizer.normalize(any())).thenReturn(TestAudio.toneWav(2500, 3000));

    Recording recording = pipeline.ingest("ana", new byte[5000], "Maria (retorno)!");

    assertThat(recording.normalized()).isTrue();
    assertThat(recording.durationMs()).isEqualTo(2500);
    assertThat(recording.ownerId()).isEqualTo("ana");
    assertThat(recording.subject()).isEqualTo("Maria retorno");
    assertThat(recording.createdAt()).isEqualTo(NOW);
  }

  @Test
  void ingest_shouldPropagateTooSmallInput() {
    when(audioNormalizer.normalize(any()))
        .thenThrow(new DecodeException(DecodeException.Reason.TOO_SMALL, "Audio is empty"));

    assertThatThrownBy(() -> pipeline.ingest("ana", new byte[10], null))
        .isInstanceOf(DecodeException.class);
  }

  @Test
  void ingest_shouldKeepOriginalBytesWhenUnreadable() {
    byte[] raw = new byte[5000];
    when(audioNormalizer.normalize(any()))
        .thenThrow(new DecodeException(DecodeException.Reason.UNREADABLE, "ffmpeg exited"));

    Recording recording = pipeline.ingest("ana", raw, " ");

    assertThat(recording.normalized()).isFalse();
    assertThat(recording.audio()).isSameAs(raw);
    assertThat(recording.durationMs()).isZero();
    assertThat(recording.hasSubject()).isFalse();
  }

  @Test
  void transcribe_shouldRecognizeSegmentsInOrderAndStitch() {
    when(recognitionClient.recognize(any()))
        .thenAnswer(
            invocation -> {
              Segment segment = invocation.getArgument(0);
              return segment.index() == 1
                  ? TranscriptFragment.unrecognized(1, false)
                  : TranscriptFragment.ok(segment.index(), "parte " + segment.number(), false);
            });

    Transcript transcript = pipeline.transcribe(recording(100_000));

    ArgumentCaptor<Segment> segments = ArgumentCaptor.forClass(Segment.class);
    InOrder order = inOrder(recognitionClient);
    order.verify(recognitionClient, times(3)).recognize(segments.capture());
    assertThat(segments.getAllValues()).extracting(Segment::index).containsExactly(0, 1, 2);

    assertThat(transcript.fragments()).hasSize(3);
    assertThat(transcript.recordingId()).isEqualTo("rec-1");
    assertThat(transcript.text())
        .isEqualTo(
            "### Segment 1\nparte 1\n\n"
                + "### Segment 2\n"
                + "[Áudio não pôde ser compreendido - verifique a qualidade do áudio]\n\n"
                + "### Segment 3\nparte 3");
    assertThat(transcript.fullySucceeded()).isFalse();
  }

  @Test
  void transcribe_shouldKeepShortRecordingWhole() {
    when(recognitionClient.recognize(any())).thenReturn(TranscriptFragment.ok(0, "bom dia", true));

    Transcript transcript = pipeline.transcribe(recording(5_000));

    assertThat(transcript.text()).isEqualTo("bom dia");
    assertThat(transcript.fragments().get(0).whole()).isTrue();
  }

  @Test
  void transcribe_shouldTagLogsWithCorrelationIdAndClearAfterwards() {
    List<String> seen = new ArrayList<>();
    when(recognitionClient.recognize(any()))
        .thenAnswer(
            invocation -> {
              seen.add(MDC.get(StructuredLogger.CORRELATION_ID));
              seen.add(MDC.get(StructuredLogger.RECORDING_ID));
              return TranscriptFragment.ok(0, "ok", true);
            });

    pipeline.transcribe(recording(1_000));

    assertThat(seen.get(0)).isNotBlank();
    assertThat(seen.get(1)).isEqualTo("rec-1");
    assertThat(MDC.get(StructuredLogger.CORRELATION_ID)).isNull();
    assertThat(MDC.get(StructuredLogger.RECORDING_ID)).isNull();
  }

  @Test
  void transcribeRaw_shouldIngestTranscribeAndImprove() {
    when(audioNormalizer.normalize(any())).thenReturn(TestAudio.toneWav(3000, 3000));
    when(recognitionClient.recognize(any()))
        .thenReturn(TranscriptFragment.ok(0, "paciente relata febre", true));
    when(refinementOrchestrator.improve(anyString(), eq("paciente relata febre")))
        .thenAnswer(
            invocation ->
                new RefinedText(invocation.getArgument(0), "Paciente relata febre.", true));

    TranscriptionResult result = pipeline.transcribe("ana", new byte[5000], "Maria", true);

    assertThat(result.text()).isEqualTo("Paciente relata febre.");
    assertThat(result.refined().transcriptId()).isEqualTo(result.transcript().id());
    assertThat(result.recording().subject()).isEqualTo("Maria");
    assertThat(MDC.get(StructuredLogger.CORRELATION_ID)).isNull();
  }

  @Test
  void transcribeRaw_shouldSkipImprovementWhenNotRequested() {
    when(audioNormalizer.normalize(any())).thenReturn(TestAudio.toneWav(3000, 3000));
    when(recognitionClient.recognize(any())).thenReturn(TranscriptFragment.ok(0, "texto", true));

    TranscriptionResult result = pipeline.transcribe("ana", new byte[5000], null, false);

    assertThat(result.text()).isEqualTo("texto");
    assertThat(result.refined().refined()).isFalse();
    verify(refinementOrchestrator, never()).improve(anyString(), anyString());
  }

  @Test
  void export_shouldTitleAfterSubject() {
    Summary summary = new Summary("t-1", "## SUMMARY", false, true, NOW);

    pipeline.export(summary, "Maria", ExportFormat.PDF);
    pipeline.export(summary, null, ExportFormat.DOCX);

    verify(documentExporter)
        .export("## SUMMARY", "Consultation Summary - Maria", ExportFormat.PDF, "Maria_summary.pdf");
    verify(documentExporter)
        .export(
            "## SUMMARY",
            "Consultation Summary - Conversation",
            ExportFormat.DOCX,
            "conversation_summary.docx");
  }

  @Test
  void export_shouldRecoverSubjectFromBaseName() {
    Summary summary = new Summary("t-1", "## SUMMARY", true, true, NOW);

    pipeline.export(summary, "ana", "ana_Maria Souza_20240305_113000", ExportFormat.PDF);

    verify(documentExporter)
        .export(
            "## SUMMARY",
            "Consultation Summary - Maria Souza",
            ExportFormat.PDF,
            "ana_Maria Souza_20240305_113000_summary.pdf");
  }

  @Test
  void artifactBaseName_shouldUseOwnerSubjectAndCreationTime() {
    Recording recording =
        new Recording("rec-1", "ana", new byte[0], 0, NOW, "Maria", true);

    String base = pipeline.artifactBaseName(recording);

    assertThat(base).isEqualTo("ana_Maria_20240305_113000");
    assertThat(ArtifactNames.recoverSubject(base, "ana")).contains("Maria");
  }

  @Test
  void archive_shouldCombineTranscriptAndSummary() {
    Summary summary = new Summary("t-1", "## SUMMARY\nok", false, true, NOW);

    String archive = pipeline.archive("bom dia", summary);

    assertThat(archive).contains("bom dia").contains("## SUMMARY\nok");
  }
}
