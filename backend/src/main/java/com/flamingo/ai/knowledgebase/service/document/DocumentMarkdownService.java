package com.flamingo.ai.knowledgebase.service.document;

import com.flamingo.ai.knowledgebase.domain.entity.Chunk;
import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.domain.repository.ChunkRepository;
import com.flamingo.ai.knowledgebase.domain.repository.DocumentRepository;
import com.flamingo.ai.knowledgebase.exception.DocumentNotFoundException;
import com.flamingo.ai.knowledgebase.service.rag.summary.DocumentSummaryService;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Rebuilds a readable document from its active chunks, with a cached LLM summary.
 *
 * <p>Parents already contain their children's text, so segments are the referenced parents
 * followed by the standalone chunks, each group in chunk order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentMarkdownService {

  static final String PARENT = "parent";
  static final String STANDALONE = "standalone";

  private static final Pattern IMAGE_URL_LINE =
      Pattern.compile(
          "^https?://\\S+\\.(png|jpg|jpeg|gif|webp|bmp)(\\?\\S*)?$", Pattern.CASE_INSENSITIVE);

  private final DocumentRepository documentRepository;
  private final ChunkRepository chunkRepository;
  private final DocumentSummaryService summaryService;

  /** One displayable piece of the document. */
  public record Segment(UUID chunkId, String type, String content) {}

  /** Reconstructed document. {@code summary} is null when none could be produced. */
  public record DocumentMarkdown(
      UUID documentId, String fileName, List<Segment> segments, String summary) {}

  /**
   * Reconstructs a document, generating and storing its summary on first request.
   *
   * @param documentId the document ID
   * @return segments and summary
   */
  @Timed(value = "document.markdown", description = "Time to reconstruct document markdown")
  public DocumentMarkdown getMarkdown(UUID documentId) {
    Document document =
        documentRepository
            .findById(documentId)
            .orElseThrow(() -> new DocumentNotFoundException(documentId));
    List<Segment> segments =
        reconstruct(chunkRepository.findByDocumentIdAndActiveTrueOrderByChunkIndexAsc(documentId));

    String summary = document.getSummary() == null ? null : document.getSummary().trim();
    if ((summary == null || summary.isEmpty()) && !segments.isEmpty()) {
      summary = summarize(document, segments);
    }
    if (summary != null && summary.isEmpty()) {
      summary = null;
    }
    return new DocumentMarkdown(documentId, document.getFileName(), segments, summary);
  }

  private String summarize(Document document, List<Segment> segments) {
    String text =
        segments.stream().map(s -> s.content().trim()).collect(Collectors.joining("\n\n"));
    String summary = summaryService.generateSummary(document.getFileName(), text);
    if (summary == null || summary.isBlank()) {
      return null;
    }
    documentRepository.updateSummary(document.getId(), summary);
    log.info("Stored summary for document {}", document.getId());
    return summary;
  }

  static List<Segment> reconstruct(List<Chunk> chunks) {
    Set<UUID> referencedParents =
        chunks.stream()
            .map(Chunk::getParentChunkId)
            .filter(Objects::nonNull)
            .collect(Collectors.toSet());
    Comparator<Chunk> byIndex = Comparator.comparingInt(Chunk::getChunkIndex);

    List<Chunk> ordered = new ArrayList<>();
    chunks.stream()
        .filter(c -> referencedParents.contains(c.getId()))
        .sorted(byIndex)
        .forEach(ordered::add);
    chunks.stream()
        .filter(c -> c.getParentChunkId() == null && !referencedParents.contains(c.getId()))
        .sorted(byIndex)
        .forEach(ordered::add);

    List<Segment> segments = new ArrayList<>();
    for (Chunk chunk : ordered) {
      String content = chunk.getContent() == null ? "" : chunk.getContent().stripTrailing();
      if (content.isEmpty()) {
        continue;
      }
      String type = referencedParents.contains(chunk.getId()) ? PARENT : STANDALONE;
      segments.add(new Segment(chunk.getId(), type, imageUrlsAsMarkdown(content)));
    }
    return segments;
  }

  /** Turns lines that hold only an image URL into Markdown images. */
  static String imageUrlsAsMarkdown(String markdown) {
    return markdown
        .lines()
        .map(
            line -> {
              String stripped = line.strip();
              return IMAGE_URL_LINE.matcher(stripped).matches()
                  ? "![image](" + stripped + ")"
                  : line;
            })
        .collect(Collectors.joining("\n"));
  }
}
