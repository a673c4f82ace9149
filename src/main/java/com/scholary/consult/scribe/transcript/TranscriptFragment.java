package com.scholary.consult.scribe.transcript;

/**
 * Recognition result for one segment.
 *
 * @param segmentIndex 0-based index of the segment it came from
 * @param status outcome of recognition
 * @param text recognized text, non-null only for {@link FragmentStatus#OK}
 * @param detail diagnostic, non-null only for {@link FragmentStatus#SERVICE_ERROR}
 * @param whole whether the segment was the unsplit recording
 */
public record TranscriptFragment(
    int segmentIndex, FragmentStatus status, String text, String detail, boolean whole) {

  public static TranscriptFragment ok(int segmentIndex, String text, boolean whole) {
    return new TranscriptFragment(segmentIndex, FragmentStatus.OK, text, null, whole);
  }

  public static TranscriptFragment empty(int segmentIndex, boolean whole) {
    return new TranscriptFragment(segmentIndex, FragmentStatus.EMPTY, null, null, whole);
  }

  public static TranscriptFragment unrecognized(int segmentIndex, boolean whole) {
    return new TranscriptFragment(segmentIndex, FragmentStatus.UNRECOGNIZED, null, null, whole);
  }

  public static TranscriptFragment serviceError(int segmentIndex, String detail, boolean whole) {
    return new TranscriptFragment(
        segmentIndex, FragmentStatus.SERVICE_ERROR, null, detail, whole);
  }

  public static TranscriptFragment timeout(int segmentIndex, boolean whole) {
    return new TranscriptFragment(segmentIndex, FragmentStatus.TIMEOUT, null, null, whole);
  }

  public boolean succeeded() {
    return status == FragmentStatus.OK;
  }

  /** The text to show for this fragment: recognized text or its failure marker. */
  public String displayText() {
    return succeeded() ? text : FailureMarkers.markerFor(this);
  }
}
