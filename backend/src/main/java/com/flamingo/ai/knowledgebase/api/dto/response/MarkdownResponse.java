package com.flamingo.ai.knowledgebase.api.dto.response;

import com.flamingo.ai.knowledgebase.service.document.DocumentMarkdownService.DocumentMarkdown;
import java.util.List;
import java.util.UUID;

/** Reconstructed document for preview. */
public record MarkdownResponse(
    UUID documentId, String fileName, List<SegmentResponse> segments, String summary) {

  /** One segment of the reconstructed document. */
  public record SegmentResponse(UUID chunkId, String type, String content) {}

  public static MarkdownResponse from(DocumentMarkdown markdown) {
    return new MarkdownResponse(
        markdown.documentId(),
        markdown.fileName(),
        markdown.segments().stream()
            .map(s -> new SegmentResponse(s.chunkId(), s.type(), s.content()))
            .toList(),
        markdown.summary());
  }
}
