package com.scholary.consult.scribe.export;

import java.util.List;

/**
 * Everything a renderer needs: a title, the generation line and the blocks in order.
 *
 * @param title document title
 * @param generatedOn the already formatted "Generated on" line
 * @param blocks parsed body blocks
 */
public record DocumentLayout(String title, String generatedOn, List<DocumentBlock> blocks) {

  public DocumentLayout {
    blocks = List.copyOf(blocks);
  }
}
