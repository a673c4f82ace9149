package com.scholary.consult.scribe.export;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.io.ByteArrayInputStream;
import java.math.BigInteger;
import java.util.List;
import org.apache.poi.xwpf.usermodel.ParagraphAlignment;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFStyle;
import org.junit.jupiter.api.Test;

class DocxDocumentRendererTest {

  private final DocxDocumentRenderer renderer = new DocxDocumentRenderer();

  private static DocumentLayout layout(String markup) {
    return new DocumentLayout(
        "Consultation Summary - Conversation",
        "Generated on 05/03/2024 11:30",
        MarkupParser.parse(markup));
  }

  private static List<XWPFParagraph> paragraphsOf(byte[] docx) throws Exception {
    XWPFDocument document = new XWPFDocument(new ByteArrayInputStream(docx));
    return document.getParagraphs();
  }

  @Test
  void render_shouldWriteTitleTimestampAndBlocks() throws Exception {
    byte[] docx = renderer.render(layout("## SUMMARY\n\n**Patient:** Maria\nNo complaints"));

    List<XWPFParagraph> paragraphs = paragraphsOf(docx);
    assertThat(paragraphs)
        .extracting(XWPFParagraph::getText)
        .containsExactly(
            "Consultation Summary - Conversation",
            "Generated on 05/03/2024 11:30",
            "",
            "SUMMARY",
            "**Patient:** Maria",
            "No complaints");
    assertThat(paragraphs.get(0).getAlignment()).isEqualTo(ParagraphAlignment.CENTER);
    assertThat(paragraphs.get(1).getAlignment()).isEqualTo(ParagraphAlignment.RIGHT);
    assertThat(paragraphs.get(3).getRuns().get(0).isBold()).isTrue();
    assertThat(paragraphs.get(5).getRuns().get(0).isBold()).isFalse();
  }

  @Test
  void render_shouldGiveTitleAndHeadingsWordStyles() throws Exception {
    byte[] docx = renderer.render(layout("## Title\n### Sub\n**Bold line**\nPlain line"));

    List<XWPFParagraph> paragraphs = paragraphsOf(docx);
    assertThat(paragraphs)
        .extracting(XWPFParagraph::getText, XWPFParagraph::getStyle)
        .containsExactly(
            tuple("Consultation Summary - Conversation", "Title"),
            tuple("Generated on 05/03/2024 11:30", null),
            tuple("", null),
            tuple("Title", "Heading1"),
            tuple("Sub", "Heading2"),
            tuple("Bold line", null),
            tuple("Plain line", null));
  }

  @Test
  void render_shouldDeclareHeadingStylesWithOutlineLevels() throws Exception {
    XWPFDocument document =
        new XWPFDocument(new ByteArrayInputStream(renderer.render(layout("## A\n### B"))));

    XWPFStyle heading = document.getStyles().getStyle("Heading1");
    XWPFStyle subheading = document.getStyles().getStyle("Heading2");
    assertThat(heading.getName()).isEqualTo("heading 1");
    assertThat(heading.getCTStyle().getPPr().getOutlineLvl().getVal()).isEqualTo(BigInteger.ZERO);
    assertThat(subheading.getName()).isEqualTo("heading 2");
    assertThat(subheading.getCTStyle().getPPr().getOutlineLvl().getVal())
        .isEqualTo(BigInteger.ONE);
    assertThat(document.getStyles().styleExist("Title")).isTrue();
  }

  @Test
  void render_shouldFormatEmphasisAsBold() throws Exception {
    List<XWPFParagraph> paragraphs = paragraphsOf(renderer.render(layout("**Important note**")));

    XWPFParagraph emphasis = paragraphs.get(3);
    assertThat(emphasis.getText()).isEqualTo("Important note");
    assertThat(emphasis.getRuns().get(0).isBold()).isTrue();
  }

  @Test
  void render_shouldBeStructurallyStable() throws Exception {
    DocumentLayout layout = layout("## A\n### B\ntext");

    assertThat(paragraphsOf(renderer.render(layout)))
        .extracting(XWPFParagraph::getText)
        .isEqualTo(
            paragraphsOf(renderer.render(layout)).stream().map(XWPFParagraph::getText).toList());
  }
}
