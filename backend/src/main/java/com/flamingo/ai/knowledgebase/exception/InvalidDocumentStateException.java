package com.flamingo.ai.knowledgebase.exception;

import com.flamingo.ai.knowledgebase.domain.enums.DocumentStatus;
import java.util.UUID;

/** Exception thrown when an operation is not allowed in the document's current status. */
public class InvalidDocumentStateException extends RuntimeException {

  private final UUID documentId;
  private final DocumentStatus status;

  public InvalidDocumentStateException(UUID documentId, DocumentStatus status, String operation) {
    super("Cannot " + operation + " document " + documentId + " in status " + status);
    this.documentId = documentId;
    this.status = status;
  }

  public UUID getDocumentId() {
    return documentId;
  }

  public DocumentStatus getStatus() {
    return status;
  }
}
