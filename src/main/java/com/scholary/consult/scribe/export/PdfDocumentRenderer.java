package com.scholary.consult.scribe.export;

import java.awt.Color;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders a layout as an A4 PDF with 72pt margins.
 *
 * <p>Text is word-wrapped to the page width and flows onto new pages as needed. The standard
 * Helvetica fonts only cover WinAnsi, so characters outside it (emoji, most non-Latin scripts) are
 * dropped rather than failing the export.
 */
@Component
public class PdfDocumentRenderer implements DocumentRenderer {

  private static final Logger LOGGER = LoggerFactory.getLogger(PdfDocumentRenderer.class);

  static final float MARGIN = 72f;
  static final float SPACER_HEIGHT = 6f;

  private static final PDFont REGULAR = PDType1Font.HELVETICA;
  private static final PDFont BOLD = PDType1Font.HELVETICA_BOLD;

  private static final Style TITLE = new Style(BOLD, 18, 22, 0, 30, new Color(0x15, 0x65, 0xc0));
  private static final Style HEADING = new Style(BOLD, 14, 18, 20, 12, new Color(0x21, 0x96, 0xf3));
  private static final Style SUBHEADING =
      new Style(BOLD, 12, 16, 15, 8, new Color(0x42, 0xa5, 0xf5));
  private static final Style EMPHASIS = new Style(BOLD, 11, 16, 0, 8, Color.BLACK);
  private static final Style NORMAL = new Style(REGULAR, 11, 16, 0, 8, Color.BLACK);

  @Override
  public ExportFormat format() {
    return ExportFormat.PDF;
  }

  @Override
  public byte[] render(DocumentLayout layout) {
    try (PDDocument document = new PDDocument()) {
      try (PageWriter writer = new PageWriter(document)) {
        writer.write(layout.title(), TITLE, true);
        writer.write(layout.generatedOn(), NORMAL, false);
        writer.space(20);

        for (DocumentBlock block : layout.blocks()) {
          switch (block.type()) {
            case HEADING -> writer.write(block.text(), HEADING, false);
            case SUBHEADING -> writer.write(block.text(), SUBHEADING, false);
            case EMPHASIS -> writer.write(block.text(), EMPHASIS, false);
            case PARAGRAPH -> writer.write(block.text(), NORMAL, false);
            case SPACER -> writer.space(SPACER_HEIGHT);
          }
        }
      }

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      document.save(out);
      LOGGER.debug(
          "Rendered PDF: pages={}, blocks={}, bytes={}",
          document.getNumberOfPages(),
          layout.blocks().size(),
          out.size());
      return out.toByteArray();
    } catch (IOException e) {
      throw new ExportException("Failed to render PDF: " + e.getMessage(), e);
    }
  }

  /** Keep only the characters the font can encode; tabs become spaces. */
  static String encodable(String text, PDFont font) {
    StringBuilder kept = new StringBuilder(text.length());
    text.replace('\t', ' ')
        .codePoints()
        .mapToObj(cp -> new String(Character.toChars(cp)))
        .filter(ch -> canEncode(font, ch))
        .forEach(kept::append);
    return kept.toString();
  }

  private static boolean canEncode(PDFont font, String ch) {
    try {
      font.encode(ch);
      return true;
    } catch (IllegalArgumentException | IOException e) {
      return false;
    }
  }

  /** Greedy word wrap; words wider than the line are broken by character. */
  static List<String> wrap(String text, PDFont font, float fontSize, float maxWidth)
      throws IOException {
    List<String> lines = new ArrayList<>();
    StringBuilder line = new StringBuilder();

    for (String word : text.split(" +")) {
      if (word.isEmpty()) {
        continue;
      }
      String candidate = line.length() == 0 ? word : line + " " + word;
      if (width(candidate, font, fontSize) <= maxWidth) {
        line.setLength(0);
        line.append(candidate);
        continue;
      }
      if (line.length() > 0) {
        lines.add(line.toString());
        line.setLength(0);
      }
      for (int i = 0; i < word.length(); i++) {
        char c = word.charAt(i);
        if (line.length() > 0 && width(line.toString() + c, font, fontSize) > maxWidth) {
          lines.add(line.toString());
          line.setLength(0);
        }
        line.append(c);
      }
    }
    if (line.length() > 0) {
      lines.add(line.toString());
    }
    return lines;
  }

  private static float width(String text, PDFont font, float fontSize) throws IOException {
    return font.getStringWidth(text) / 1000f * fontSize;
  }

  private record Style(
      PDFont font, float size, float leading, float spaceBefore, float spaceAfter, Color color) {}

  /** Tracks the current page and vertical position, opening pages as content overflows. */
  private static final class PageWriter implements AutoCloseable {

    private final PDDocument document;
    private final float width = PDRectangle.A4.getWidth() - 2 * MARGIN;
    private PDPageContentStream stream;
    private float y;

    PageWriter(PDDocument document) throws IOException {
      this.document = document;
      newPage();
    }

    void write(String text, Style style, boolean centered) throws IOException {
      String clean = encodable(text, style.font());
      space(style.spaceBefore());
      for (String line : wrap(clean, style.font(), style.size(), width)) {
        if (y - style.leading() < MARGIN) {
          newPage();
        }
        y -= style.leading();
        float x = MARGIN;
        if (centered) {
          x += (width - PdfDocumentRenderer.width(line, style.font(), style.size())) / 2;
        }
        stream.beginText();
        stream.setFont(style.font(), style.size());
        stream.setNonStrokingColor(style.color());
        stream.newLineAtOffset(x, y);
        stream.showText(line);
        stream.endText();
      }
      space(style.spaceAfter());
    }

    void space(float height) {
      y -= height;
      if (y < MARGIN) {
        // the next write opens a new page
        y = MARGIN;
      }
    }

    private void newPage() throws IOException {
      if (stream != null) {
        stream.close();
      }
      PDPage page = new PDPage(PDRectangle.A4);
      document.addPage(page);
      stream = new PDPageContentStream(document, page);
      y = PDRectangle.A4.getHeight() - MARGIN;
    }

    @Override
    public void close() throws IOException {
      stream.close();
    }
  }
}
