package com.scholary.consult.scribe.export;

import java.util.ArrayList;
import java.util.List;

/**
 * Line-oriented parser for the heading/bold markup returned by the summarizer.
 *
 * <p>Each line is trimmed, then classified by its prefix: {@code ### } before {@code ## }, a line
 * both starting and ending with {@code **} is emphasis, a blank line is a spacer and anything else
 * is a paragraph. Inline markup inside a paragraph is kept as written.
 */
public final class MarkupParser {

  private MarkupParser() {}

  public static List<DocumentBlock> parse(String markup) {
    List<DocumentBlock> blocks = new ArrayList<>();
    if (markup == null || markup.isEmpty()) {
      return blocks;
    }

    markup.lines().forEach(raw -> blocks.add(parseLine(raw.strip())));
    return blocks;
  }

  static DocumentBlock parseLine(String line) {
    if (line.isEmpty()) {
      return DocumentBlock.spacer();
    }
    if (line.startsWith("### ")) {
      return new DocumentBlock(BlockType.SUBHEADING, line.substring(4).strip());
    }
    if (line.startsWith("## ")) {
      return new DocumentBlock(BlockType.HEADING, line.substring(3).strip());
    }
    if (line.startsWith("**") && line.endsWith("**")) {
      // a bare "**" or "***" leaves no text between the markers
      String inner = line.length() >= 4 ? line.substring(2, line.length() - 2).strip() : "";
      return new DocumentBlock(BlockType.EMPHASIS, inner);
    }
    return new DocumentBlock(BlockType.PARAGRAPH, line);
  }
}
