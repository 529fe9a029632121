package com.flamingo.ai.knowledgebase.exception;

/** Exception thrown when the blob store rejects or fails an operation. */
public class StorageException extends RuntimeException {

  private final String objectKey;

  public StorageException(String objectKey, String message, Throwable cause) {
    super(message, cause);
    this.objectKey = objectKey;
  }

  public String getObjectKey() {
    return objectKey;
  }
}
