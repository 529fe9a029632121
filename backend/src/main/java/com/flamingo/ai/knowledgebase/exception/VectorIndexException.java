package com.flamingo.ai.knowledgebase.exception;

/** Exception thrown when the vector index rejects a write, search or delete. */
public class VectorIndexException extends RuntimeException {

  public VectorIndexException(String message) {
    super(message);
  }

  public VectorIndexException(String message, Throwable cause) {
    super(message, cause);
  }
}
