package com.scholary.consult.scribe.export;

/** Renders a layout into one document encoding. */
public interface DocumentRenderer {

  ExportFormat format();

  /**
   * Render the layout.
   *
   * @throws ExportException if the document cannot be produced
   */
  byte[] render(DocumentLayout layout);
}
