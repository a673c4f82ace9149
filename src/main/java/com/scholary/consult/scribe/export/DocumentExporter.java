package com.scholary.consult.scribe.export;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Parses summary markup and hands it to the renderer for the requested format. */
@Service
public class DocumentExporter {

  private static final Logger LOGGER = LoggerFactory.getLogger(DocumentExporter.class);

  private final Map<ExportFormat, DocumentRenderer> renderers = new EnumMap<>(ExportFormat.class);
  private final Clock clock;
  private final ZoneId zone;
  private final DateTimeFormatter timestampFormat;

  public DocumentExporter(
      List<DocumentRenderer> renderers, ExportProperties properties, Clock clock) {
    for (DocumentRenderer renderer : renderers) {
      this.renderers.put(renderer.format(), renderer);
    }
    this.clock = clock;
    this.zone = ZoneId.of(properties.zoneId());
    this.timestampFormat = DateTimeFormatter.ofPattern(properties.timestampPattern());
  }

  /**
   * Render markup as a document.
   *
   * @param markup heading/bold markup, usually a summary
   * @param title document title
   * @param format target encoding
   * @param fileName file name for the result, extension included
   * @throws ExportException if no renderer handles the format or rendering fails
   */
  public ExportedDocument export(
      String markup, String title, ExportFormat format, String fileName) {
    DocumentRenderer renderer = renderers.get(format);
    if (renderer == null) {
      throw new ExportException("No renderer for format " + format);
    }

    DocumentLayout layout =
        new DocumentLayout(title, "Generated on " + now(), MarkupParser.parse(markup));
    byte[] content = renderer.render(layout);

    LOGGER.info(
        "Exported document: file={}, format={}, bytes={}", fileName, format, content.length);
    return new ExportedDocument(fileName, format, format.contentType(), content);
  }

  private String now() {
    return timestampFormat.format(clock.instant().atZone(zone));
  }
}
