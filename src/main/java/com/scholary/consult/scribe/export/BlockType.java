package com.scholary.consult.scribe.export;

/** Kind of a parsed markup line. */
public enum BlockType {
  /** {@code ## text} */
  HEADING,
  /** {@code ### text} */
  SUBHEADING,
  /** A whole line wrapped in {@code **}. */
  EMPHASIS,
  PARAGRAPH,
  /** A blank line. */
  SPACER
}
