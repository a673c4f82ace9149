package com.scholary.consult.scribe.export;

/**
 * One typed block of a document, with its markup syntax removed.
 *
 * @param type the block kind
 * @param text the display text, empty for {@link BlockType#SPACER}
 */
public record DocumentBlock(BlockType type, String text) {

  public static DocumentBlock spacer() {
    return new DocumentBlock(BlockType.SPACER, "");
  }
}
