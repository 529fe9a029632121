package com.flamingo.ai.knowledgebase.service.rag.parsing;

import java.util.List;

/**
 * Output of a parser backend.
 *
 * @param markdown full markdown rendering, may be empty
 * @param blocks normalized blocks in reading order
 * @param engine name of the backend that produced the result
 * @param engineVersion backend version or model tag
 */
public record ParseResult(
    String markdown, List<Block> blocks, String engine, String engineVersion) {

  public ParseResult {
    markdown = markdown == null ? "" : markdown;
    blocks = blocks == null ? List.of() : blocks;
  }

  /** True if neither blocks nor markdown were produced. */
  public boolean isEmpty() {
    return blocks.isEmpty() && markdown.isBlank();
  }
}
