package com.scholary.consult.scribe.transcript;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Joins per-segment fragments into one transcript text.
 *
 * <p>A single fragment is returned verbatim. Several fragments are each put under a {@code ###
 * Segment N} header, in ascending index order whatever order they arrived in, and separated by a
 * blank line.
 */
@Component
public class TranscriptStitcher {

  static final String SEPARATOR = "\n\n";

  public String stitch(List<TranscriptFragment> fragments) {
    if (fragments.isEmpty()) {
      throw new IllegalArgumentException("Nothing to stitch");
    }
    if (fragments.size() == 1) {
      return fragments.get(0).displayText();
    }

    return fragments.stream()
        .sorted(Comparator.comparingInt(TranscriptFragment::segmentIndex))
        .map(f -> header(f.segmentIndex()) + "\n" + f.displayText())
        .collect(Collectors.joining(SEPARATOR));
  }

  static String header(int segmentIndex) {
    return "### Segment " + (segmentIndex + 1);
  }
}
