package com.flamingo.ai.knowledgebase.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String DOCUMENT_NOT_FOUND = "DOCUMENT_001";
  public static final String DOCUMENT_PROCESSING_ERROR = "DOCUMENT_002";
  public static final String DOCUMENT_INVALID_STATE = "DOCUMENT_003";
  public static final String DOCUMENT_UNSUPPORTED_TYPE = "DOCUMENT_004";
  public static final String DOCUMENT_TOO_LARGE = "DOCUMENT_005";
  public static final String STORAGE_ERROR = "STORAGE_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
