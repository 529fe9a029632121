package com.flamingo.ai.knowledgebase.exception;

import java.util.UUID;

/**
 * Thrown when a pipeline step fails for a document.
 *
 * <p>The pipeline catches it and records the message in the document error log; it only reaches
 * the REST layer when a synchronous step (such as the fast path) surfaces it.
 */
public class DocumentProcessingException extends RuntimeException {

  private final UUID documentId;
  private final String userMessage;

  public DocumentProcessingException(UUID documentId, String message) {
    super(message);
    this.documentId = documentId;
    this.userMessage = "Failed to process document";
  }

  public DocumentProcessingException(UUID documentId, String message, Throwable cause) {
    super(message, cause);
    this.documentId = documentId;
    this.userMessage = "Failed to process document";
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
