package com.scholary.consult.scribe.export;

/**
 * A rendered document, ready to hand to a caller.
 *
 * @param fileName suggested file name, extension included
 * @param format the encoding
 * @param contentType MIME type of {@code content}
 * @param content rendered bytes
 */
public record ExportedDocument(
    String fileName, ExportFormat format, String contentType, byte[] content) {}
