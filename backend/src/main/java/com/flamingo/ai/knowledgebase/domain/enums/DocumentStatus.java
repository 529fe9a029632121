package com.flamingo.ai.knowledgebase.domain.enums;

import java.util.EnumSet;
import java.util.Set;

/**
 * Processing status of an uploaded document.
 *
 * <p>Every status carries the set of statuses it may move to. Writers must check {@link
 * #canTransitionTo(DocumentStatus)} (or use a status-guarded update) before persisting a change.
 */
public enum DocumentStatus {
  /** Stored in the blob store and registered, pipeline not started. */
  UPLOADED,

  /** Parser chain is running. */
  PARSING,

  /** Blocks extracted; images and chunking in progress. */
  PARSED,

  /** Chunks persisted; vectors being computed and indexed. */
  EMBEDDING,

  /** All children indexed; searchable. */
  READY,

  /** A pipeline step failed; see the document error log. */
  FAILED;

  static {
    UPLOADED.next = EnumSet.of(PARSING, EMBEDDING, FAILED);
    PARSING.next = EnumSet.of(PARSED, FAILED);
    PARSED.next = EnumSet.of(EMBEDDING, FAILED);
    EMBEDDING.next = EnumSet.of(READY, FAILED);
    READY.next = EnumSet.of(PARSING, UPLOADED);
    FAILED.next = EnumSet.of(PARSING, UPLOADED);
  }

  private Set<DocumentStatus> next;

  /** Returns true if a document in this status may move to {@code target}. */
  public boolean canTransitionTo(DocumentStatus target) {
    return next.contains(target);
  }

  /** Returns every status from which {@code target} may be entered. */
  public static Set<DocumentStatus> predecessorsOf(DocumentStatus target) {
    Set<DocumentStatus> result = EnumSet.noneOf(DocumentStatus.class);
    for (DocumentStatus status : values()) {
      if (status.canTransitionTo(target)) {
        result.add(status);
      }
    }
    return result;
  }

  /** True while the pipeline owns the document. */
  public boolean isRunning() {
    return this == PARSING || this == PARSED || this == EMBEDDING;
  }
}
