package com.flamingo.ai.knowledgebase.exception;

/** Exception thrown when an upload has an extension no parser handles. */
public class UnsupportedFileTypeException extends RuntimeException {

  private final String fileName;

  public UnsupportedFileTypeException(String fileName, String message) {
    super(message);
    this.fileName = fileName;
  }

  public String getFileName() {
    return fileName;
  }
}
