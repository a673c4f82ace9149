package com.scholary.consult.scribe.export;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import org.springframework.stereotype.Component;

/**
 * Composes the full-conversation text kept alongside each summary: the original transcript and the
 * generated summary, separated by a rule, for later reference.
 */
@Component
public class ConversationArchiveWriter {

  static final String RULE = "=".repeat(80);

  private final Clock clock;
  private final ZoneId zone;
  private final DateTimeFormatter timestampFormat;

  public ConversationArchiveWriter(ExportProperties properties, Clock clock) {
    this.clock = clock;
    this.zone = ZoneId.of(properties.zoneId());
    this.timestampFormat = DateTimeFormatter.ofPattern(properties.timestampPattern());
  }

  public String compose(String transcriptText, String summaryText) {
    String timestamp = timestampFormat.format(clock.instant().atZone(zone));
    return "# FULL CONVERSATION - "
        + timestamp
        + "\n\n## ORIGINAL TRANSCRIPT\n\n"
        + transcriptText
        + "\n\n"
        + RULE
        + "\n\n## AI-GENERATED SUMMARY\n\n"
        + summaryText
        + "\n\n"
        + RULE
        + "\n\nGenerated automatically. Holds the original transcript and the generated summary"
        + " for future reference.\n";
  }
}
