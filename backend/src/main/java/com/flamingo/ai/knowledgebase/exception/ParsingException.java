package com.flamingo.ai.knowledgebase.exception;

/** Thrown by a parser backend that could not produce blocks, or by the chain when all failed. */
public class ParsingException extends RuntimeException {

  private final String engine;

  public ParsingException(String engine, String message) {
    super(message);
    this.engine = engine;
  }

  public ParsingException(String engine, String message, Throwable cause) {
    super(message, cause);
    this.engine = engine;
  }

  public String getEngine() {
    return engine;
  }
}
