package com.scholary.consult.scribe.service;

import com.scholary.consult.scribe.audio.AudioNormalizer;
import com.scholary.consult.scribe.audio.DecodeException;
import com.scholary.consult.scribe.audio.Recording;
import com.scholary.consult.scribe.audio.WavCodec;
import com.scholary.consult.scribe.export.ConversationArchiveWriter;
import com.scholary.consult.scribe.export.DocumentExporter;
import com.scholary.consult.scribe.export.ExportFormat;
import com.scholary.consult.scribe.export.ExportedDocument;
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
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Runs a consultation recording through every stage: normalize, segment, recognize, stitch,
 * refine and export.
 *
 * <p>Each call runs synchronously on the caller's thread. Every run carries a correlation id in
 * the MDC; a nested call reuses the id of the run that started it. Transcription holds the
 * recording's lock, so two runs on one recording happen one after the other, and segments are
 * recognized strictly in index order.
 */
@Service
public class ConsultationPipeline {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConsultationPipeline.class);

  private final AudioNormalizer audioNormalizer;
  private final AudioSegmenter audioSegmenter;
  private final RecognitionClient recognitionClient;
  private final TranscriptStitcher transcriptStitcher;
  private final RefinementOrchestrator refinementOrchestrator;
  private final DocumentExporter documentExporter;
  private final ConversationArchiveWriter archiveWriter;
  private final RecordingLocks recordingLocks;
  private final ArtifactNames artifactNames;
  private final Clock clock;

  public ConsultationPipeline(
      AudioNormalizer audioNormalizer,
      AudioSegmenter audioSegmenter,
      RecognitionClient recognitionClient,
      TranscriptStitcher transcriptStitcher,
      RefinementOrchestrator refinementOrchestrator,
      DocumentExporter documentExporter,
      ConversationArchiveWriter archiveWriter,
      RecordingLocks recordingLocks,
      ArtifactNames artifactNames,
      Clock clock) {
    this.audioNormalizer = audioNormalizer;
    this.audioSegmenter = audioSegmenter;
    this.recognitionClient = recognitionClient;
    this.transcriptStitcher = transcriptStitcher;
    this.refinementOrchestrator = refinementOrchestrator;
    this.documentExporter = documentExporter;
    this.archiveWriter = archiveWriter;
    this.recordingLocks = recordingLocks;
    this.artifactNames = artifactNames;
    this.clock = clock;
  }

  /**
   * Normalize raw audio into a recording.
   *
   * <p>If the decoder cannot read the input, the recording keeps the original bytes so the
   * recognition fallback chain can still try them.
   *
   * @param ownerId the owning user
   * @param rawAudio audio in any supported container
   * @param subject optional subject label, usually the patient's name
   * @throws DecodeException with reason TOO_SMALL if the input is too small to be audio
   */
  public Recording ingest(String ownerId, byte[] rawAudio, String subject) {
    String recordingId = UUID.randomUUID().toString();
    return inRunContext(
        ownerId,
        recordingId,
        () -> {
          String label = ArtifactNames.sanitize(subject);
          String cleanSubject = label.isEmpty() ? null : label;

          try {
            byte[] wav = audioNormalizer.normalize(rawAudio);
            long durationMs = WavCodec.durationMillis(wav);
            LOGGER.info(
                "Recording ingested: id={}, bytes={}, durationMs={}",
                recordingId,
                wav.length,
                durationMs);
            return new Recording(
                recordingId, ownerId, wav, durationMs, clock.instant(), cleanSubject, true);

          } catch (DecodeException e) {
            if (e.reason() == DecodeException.Reason.TOO_SMALL) {
              LOGGER.warn("Recording rejected: id={}, {}", recordingId, e.getMessage());
              throw e;
            }
            LOGGER.warn(
                "Normalization failed, keeping original bytes: id={}, error={}",
                recordingId,
                e.getMessage());
            return new Recording(
                recordingId, ownerId, rawAudio, 0, clock.instant(), cleanSubject, false);
          }
        });
  }

  /**
   * Recognize every segment of a recording and stitch the results.
   *
   * @throws RecordingBusyException if another run holds the recording for too long
   */
  public Transcript transcribe(Recording recording) {
    return inRunContext(
        recording.ownerId(),
        recording.id(),
        () -> recordingLocks.withLock(recording.id(), () -> recognizeAll(recording)));
  }

  /**
   * Ingest, transcribe and optionally improve in one call.
   *
   * @param improve whether to run the improvement pass on the stitched text
   */
  public TranscriptionResult transcribe(
      String ownerId, byte[] rawAudio, String subject, boolean improve) {
    return inRunContext(
        ownerId,
        null,
        () -> {
          Recording recording = ingest(ownerId, rawAudio, subject);
          MDC.put(StructuredLogger.RECORDING_ID, recording.id());
          Transcript transcript = transcribe(recording);
          RefinedText refined =
              improve
                  ? improve(transcript)
                  : new RefinedText(transcript.id(), transcript.text(), false);
          return new TranscriptionResult(recording, transcript, refined);
        });
  }

  public RefinedText improve(Transcript transcript) {
    return inRunContext(
        transcript.ownerId(),
        transcript.recordingId(),
        () -> refinementOrchestrator.improve(transcript.id(), transcript.text()));
  }

  /**
   * Summarize transcript text.
   *
   * @param instruction optional caller instruction; {@code null} selects the default layout
   * @throws com.scholary.consult.scribe.refinement.SummarizationException if generation fails
   */
  public Summary summarize(String transcriptId, String text, String instruction) {
    return inRunContext(
        null, null, () -> refinementOrchestrator.summarize(transcriptId, text, instruction));
  }

  /**
   * Render a summary as a document titled after the subject.
   *
   * @throws com.scholary.consult.scribe.export.ExportException if rendering fails
   */
  public ExportedDocument export(Summary summary, String subject, ExportFormat format) {
    String clean = ArtifactNames.sanitize(subject);
    String fileName =
        (clean.isEmpty() ? ArtifactNames.DEFAULT_SUBJECT : clean)
            + "_summary."
            + format.extension();
    return inRunContext(
        null,
        null,
        () ->
            documentExporter.export(
                summary.text(), ArtifactNames.title(subject), format, fileName));
  }

  /**
   * Render a summary stored under an artifact base name; the subject comes from the name.
   *
   * @param baseName the {@code <owner>_<subject>_<timestamp>} base of the recording
   */
  public ExportedDocument export(
      Summary summary, String ownerId, String baseName, ExportFormat format) {
    String subject = ArtifactNames.recoverSubject(baseName, ownerId).orElse(null);
    return inRunContext(
        ownerId,
        null,
        () ->
            documentExporter.export(
                summary.text(),
                ArtifactNames.title(subject),
                format,
                ArtifactNames.export(baseName, format)));
  }

  /** Base name under which every artifact of the recording is stored. */
  public String artifactBaseName(Recording recording) {
    return artifactNames.baseName(recording.ownerId(), recording.subject(), recording.createdAt());
  }

  /** Compose the full-conversation text holding the transcript and its summary. */
  public String archive(String transcriptText, Summary summary) {
    return archiveWriter.compose(transcriptText, summary.text());
  }

  private Transcript recognizeAll(Recording recording) {
    long startTime = System.currentTimeMillis();
    List<Segment> segments = audioSegmenter.segment(recording);

    LOGGER.info(
        "Starting transcription: recordingId={}, segments={}, durationMs={}",
        recording.id(),
        segments.size(),
        recording.durationMs());

    List<TranscriptFragment> fragments = new ArrayList<>(segments.size());
    for (Segment segment : segments) {
      fragments.add(recognitionClient.recognize(segment));
    }

    String text = transcriptStitcher.stitch(fragments);
    Transcript transcript =
        new Transcript(
            UUID.randomUUID().toString(),
            recording.ownerId(),
            recording.id(),
            fragments,
            text,
            clock.instant());

    long failed = fragments.stream().filter(f -> !f.succeeded()).count();
    LOGGER.info(
        "Transcription complete: recordingId={}, transcriptId={}, segments={}, failed={}, chars={},"
            + " took={}ms",
        recording.id(),
        transcript.id(),
        fragments.size(),
        failed,
        text.length(),
        System.currentTimeMillis() - startTime);
    return transcript;
  }

  /** Run with a correlation id in the MDC, reusing one already set by an outer run. */
  private <T> T inRunContext(String ownerId, String recordingId, Supplier<T> action) {
    if (MDC.get(StructuredLogger.CORRELATION_ID) != null) {
      return action.get();
    }
    StructuredLogger.setRunContext(UUID.randomUUID().toString(), ownerId, recordingId);
    try {
      return action.get();
    } finally {
      StructuredLogger.clearRunContext();
    }
  }
}
