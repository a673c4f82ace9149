package com.scholary.consult.scribe.export;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.apache.poi.xwpf.usermodel.XWPFStyles;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.CTStyle;
import org.openxmlformats.schemas.wordprocessingml.x2006.main.STStyleType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Renders a layout as a Word document.
 *
 * <p>The title and headings carry Word's built-in Title, Heading1 and Heading2 styles, declared in
 * the document with outline levels so they show in the navigation pane and a table of contents.
 * Visual formatting is still applied directly to runs, so the output looks the same in editors
 * that ignore style definitions. Spacers are dropped; Word's paragraph spacing already separates
 * blocks.
 */
@Component
public class DocxDocumentRenderer implements DocumentRenderer {

  private static final Logger LOGGER = LoggerFactory.getLogger(DocxDocumentRenderer.class);

  static final String TITLE_STYLE = "Title";
  static final String HEADING_STYLE = "Heading1";
  static final String SUBHEADING_STYLE = "Heading2";

  @Override
  public ExportFormat format() {
    return ExportFormat.DOCX;
  }

  @Override
  public byte[] render(DocumentLayout layout) {
    try (XWPFDocument document = new XWPFDocument()) {
      declareStyles(document);
      addParagraph(document, layout.title(), ParagraphAlignment.CENTER, true, 18, "1565C0")
          .setStyle(TITLE_STYLE);
      addParagraph(document, layout.generatedOn(), ParagraphAlignment.RIGHT, false, 11, null);
      document.createParagraph();

      for (DocumentBlock block : layout.blocks()) {
        switch (block.type()) {
          case HEADING -> addParagraph(
                  document, block.text(), ParagraphAlignment.LEFT, true, 14, "2196F3")
              .setStyle(HEADING_STYLE);
          case SUBHEADING -> addParagraph(
                  document, block.text(), ParagraphAlignment.LEFT, true, 12, "42A5F5")
              .setStyle(SUBHEADING_STYLE);
          case EMPHASIS -> addParagraph(
              document, block.text(), ParagraphAlignment.LEFT, true, 11, null);
          case PARAGRAPH -> addParagraph(
              document, block.text(), ParagraphAlignment.LEFT, false, 11, null);
          case SPACER -> {
            // no-op
          }
        }
      }

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      document.write(out);
      LOGGER.debug("Rendered DOCX: blocks={}, bytes={}", layout.blocks().size(), out.size());
      return out.toByteArray();
    } catch (IOException e) {
      throw new ExportException("Failed to render DOCX: " + e.getMessage(), e);
    }
  }

  private static void declareStyles(XWPFDocument document) {
    XWPFStyles styles = document.createStyles();
    addStyle(styles, TITLE_STYLE, "Title", null);
    addStyle(styles, HEADING_STYLE, "heading 1", 0);
    addStyle(styles, SUBHEADING_STYLE, "heading 2", 1);
  }

  private static void addStyle(XWPFStyles styles, String id, String name, Integer outlineLevel) {
    CTStyle style = CTStyle.Factory.newInstance();
    style.setStyleId(id);
    style.setType(STStyleType.PARAGRAPH);
    style.addNewName().setVal(name);
    style.addNewQFormat();
    if (outlineLevel != null) {
      style.addNewPPr().addNewOutlineLvl().setVal(BigInteger.valueOf(outlineLevel));
    }
    styles.addStyle(new XWPFStyle(style, styles));
  }

  private static XWPFParagraph addParagraph(
      XWPFDocument document,
      String text,
      ParagraphAlignment alignment,
      boolean bold,
      int fontSize,
      String color) {
    XWPFParagraph paragraph = document.createParagraph();
    paragraph.setAlignment(alignment);
    XWPFRun run = paragraph.createRun();
    run.setText(text);
    run.setBold(bold);
    run.setFontSize(fontSize);
    if (color != null) {
      run.setColor(color);
    }
    return paragraph;
  }
}
