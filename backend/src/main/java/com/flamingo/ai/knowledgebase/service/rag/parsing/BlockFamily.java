package com.flamingo.ai.knowledgebase.service.rag.parsing;

/** Grouping of block types that the chunker treats alike. */
public enum BlockFamily {
  /** Page furniture that never reaches a chunk. */
  NOISE,
  TEXT,
  TABLE,
  IMAGE,
  CODE;

  /** Atomic families are never split across chunk boundaries. */
  public boolean isAtomic() {
    return this == TABLE || this == IMAGE || this == CODE;
  }
}
