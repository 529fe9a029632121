package com.flamingo.ai.knowledgebase.domain.enums;

/** Kind of content a chunk carries. */
public enum ChunkType {
  TEXT,
  TABLE,
  IMAGE_CAPTION,
  CODE
}
