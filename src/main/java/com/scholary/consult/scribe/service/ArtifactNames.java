package com.scholary.consult.scribe.service;

import com.scholary.consult.scribe.export.ExportFormat;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Deterministic names for the artifacts of one recording.
 *
 * <p>Every name starts from a base of {@code <owner>_<subject|conversation>_<yyyyMMdd_HHmmss>};
 * the timestamp is the recording's creation time. Suffixes tell the artifacts apart.
 */
@Component
public class ArtifactNames {

  static final String DEFAULT_SUBJECT = "conversation";
  static final String DEFAULT_TITLE_SUBJECT = "Conversation";
  static final String TITLE_PREFIX = "Consultation Summary - ";

  private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
  private static final Pattern UNSAFE =
      Pattern.compile("[^\\w\\s-]", Pattern.UNICODE_CHARACTER_CLASS);
  private static final Pattern TIMESTAMP_SUFFIX = Pattern.compile("_\\d{8}_\\d{6}$");

  private final ZoneId zone;

  public ArtifactNames(PipelineProperties properties) {
    this.zone = ZoneId.of(properties.zoneId());
  }

  /** Strip everything but word characters, whitespace and hyphens, then trim. */
  public static String sanitize(String label) {
    if (label == null) {
      return "";
    }
    return UNSAFE.matcher(label).replaceAll("").strip();
  }

  public String baseName(String ownerId, String subject, Instant createdAt) {
    String clean = sanitize(subject);
    return ownerId
        + "_"
        + (clean.isEmpty() ? DEFAULT_SUBJECT : clean)
        + "_"
        + TIMESTAMP.format(createdAt.atZone(zone));
  }

  public static String recording(String baseName) {
    return baseName + ".wav";
  }

  public static String transcript(String baseName) {
    return baseName + "_transcript.txt";
  }

  public static String summary(String baseName) {
    return baseName + "_summary.txt";
  }

  public static String fullConversation(String baseName) {
    return baseName + "_full_conversation.txt";
  }

  public static String export(String baseName, ExportFormat format) {
    return baseName + "_summary." + format.extension();
  }

  /**
   * Recover the subject label from a base name.
   *
   * @return the subject, or empty when the base name carries the default or does not belong to
   *     the owner
   */
  public static Optional<String> recoverSubject(String baseName, String ownerId) {
    String prefix = ownerId + "_";
    if (!baseName.startsWith(prefix)) {
      return Optional.empty();
    }
    String subject = TIMESTAMP_SUFFIX.matcher(baseName.substring(prefix.length())).replaceFirst("");
    if (subject.isEmpty() || subject.equals(DEFAULT_SUBJECT)) {
      return Optional.empty();
    }
    return Optional.of(subject);
  }

  /** Title for an exported summary. */
  public static String title(String subject) {
    String clean = sanitize(subject);
    return TITLE_PREFIX + (clean.isEmpty() ? DEFAULT_TITLE_SUBJECT : clean);
  }
}
