package com.scholary.consult.scribe.transcript;

/**
 * Text shown in place of a fragment that produced no usable speech.
 *
 * <p>Every marker is a single line starting with {@code [}. Texts match the recognition locale
 * (pt-BR).
 */
public final class FailureMarkers {

  public static final String EMPTY_WHOLE = "[Áudio vazio ou muito baixo]";
  public static final String EMPTY_SEGMENT = "[Segmento silencioso]";
  public static final String UNRECOGNIZED =
      "[Áudio não pôde ser compreendido - verifique a qualidade do áudio]";
  public static final String TIMEOUT =
      "[Erro: Timeout na transcrição - o arquivo pode ser muito longo ou a conexão está lenta]";
  private static final String SERVICE_ERROR_PREFIX = "[Erro no serviço de reconhecimento: ";

  private FailureMarkers() {}

  public static String markerFor(TranscriptFragment fragment) {
    return switch (fragment.status()) {
      case OK -> throw new IllegalArgumentException("Fragment succeeded, it has no marker");
      case EMPTY -> fragment.whole() ? EMPTY_WHOLE : EMPTY_SEGMENT;
      case UNRECOGNIZED -> UNRECOGNIZED;
      case TIMEOUT -> TIMEOUT;
      case SERVICE_ERROR -> serviceError(fragment.detail());
    };
  }

  static String serviceError(String detail) {
    String oneLine = detail == null ? "desconhecido" : detail.replaceAll("\\s+", " ").trim();
    return SERVICE_ERROR_PREFIX + oneLine.replace("]", ")") + "]";
  }

  /**
   * Whether the text as a whole is a failure marker and should not be sent for refinement.
   *
   * <p>Only the start of the text counts. A stitched transcript opens with a segment header, so a
   * failed segment inside it does not hold back the segments that were recognized.
   */
  public static boolean carriesFailure(String text) {
    return text != null && text.stripLeading().startsWith("[");
  }
}
