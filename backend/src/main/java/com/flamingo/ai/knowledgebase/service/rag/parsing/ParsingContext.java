package com.flamingo.ai.knowledgebase.service.rag.parsing;

import java.util.UUID;

/**
 * Input handed to each parser in the chain.
 *
 * @param documentId document being parsed
 * @param fileName original file name
 * @param storagePath object key of the stored original
 * @param bytes file content
 */
public record ParsingContext(UUID documentId, String fileName, String storagePath, byte[] bytes) {

  /** Lower-case extension without the dot, or empty. */
  public String extension() {
    return SupportedFileTypes.extensionOf(fileName);
  }

  public boolean isPdf() {
    return "pdf".equals(extension());
  }

  public String mimeType() {
    return SupportedFileTypes.mimeTypeOf(fileName);
  }

  @Override
  public String toString() {
    return "ParsingContext[" + documentId + ", " + fileName + "]";
  }
}
