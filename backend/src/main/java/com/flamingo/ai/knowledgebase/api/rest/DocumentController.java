package com.flamingo.ai.knowledgebase.api.rest;

import com.flamingo.ai.knowledgebase.api.dto.response.ChunkResponse;
import com.flamingo.ai.knowledgebase.api.dto.response.DocumentResponse;
import com.flamingo.ai.knowledgebase.api.dto.response.MarkdownResponse;
import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.service.document.DocumentMarkdownService;
import com.flamingo.ai.knowledgebase.service.document.DocumentService;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for the document registry. */
@RestController
@RequestMapping
@RequiredArgsConstructor
public class DocumentController {

  private final DocumentService documentService;
  private final DocumentMarkdownService markdownService;

  /** Uploads a document to a collection. Returns 200 when the content was already there. */
  @PostMapping(
      value = "/collections/{collectionId}/documents",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<DocumentResponse> uploadDocument(
      @PathVariable String collectionId, @RequestParam("file") MultipartFile file) {
    DocumentService.Registration registration = documentService.register(collectionId, file);
    HttpStatus status = registration.deduplicated() ? HttpStatus.OK : HttpStatus.CREATED;
    return ResponseEntity.status(status)
        .body(DocumentResponse.fromEntity(registration.document()));
  }

  /** Gets all documents of a collection. */
  @GetMapping("/collections/{collectionId}/documents")
  public ResponseEntity<List<DocumentResponse>> getDocumentsByCollection(
      @PathVariable String collectionId) {
    List<Document> documents = documentService.getDocumentsByCollection(collectionId);
    List<DocumentResponse> responses =
        documents.stream().map(DocumentResponse::fromEntity).toList();
    return ResponseEntity.ok(responses);
  }

  /** Gets a document by ID. */
  @GetMapping("/documents/{documentId}")
  public ResponseEntity<DocumentResponse> getDocument(@PathVariable UUID documentId) {
    Document document = documentService.getDocument(documentId);
    return ResponseEntity.ok(DocumentResponse.fromEntity(document));
  }

  /** Starts processing an uploaded or failed document. */
  @PostMapping("/documents/{documentId}/process")
  public ResponseEntity<DocumentResponse> processDocument(@PathVariable UUID documentId) {
    Document document = documentService.process(documentId);
    return ResponseEntity.accepted().body(DocumentResponse.fromEntity(document));
  }

  /** Discards chunks and vectors and processes the document again. */
  @PostMapping("/documents/{documentId}/reparse")
  public ResponseEntity<DocumentResponse> reparseDocument(@PathVariable UUID documentId) {
    Document document = documentService.reparse(documentId);
    return ResponseEntity.accepted().body(DocumentResponse.fromEntity(document));
  }

  /** Lists the chunks of a document. */
  @GetMapping("/documents/{documentId}/chunks")
  public ResponseEntity<List<ChunkResponse>> getChunks(
      @PathVariable UUID documentId,
      @RequestParam(defaultValue = "true") boolean activeOnly) {
    List<ChunkResponse> chunks =
        documentService.getChunks(documentId, activeOnly).stream()
            .map(ChunkResponse::fromEntity)
            .toList();
    return ResponseEntity.ok(chunks);
  }

  /** Reconstructs the document as Markdown segments with a summary. */
  @GetMapping("/documents/{documentId}/markdown")
  public ResponseEntity<MarkdownResponse> getMarkdown(@PathVariable UUID documentId) {
    return ResponseEntity.ok(MarkdownResponse.from(markdownService.getMarkdown(documentId)));
  }

  /** Deletes a document. */
  @DeleteMapping("/documents/{documentId}")
  public ResponseEntity<Void> deleteDocument(@PathVariable UUID documentId) {
    documentService.deleteDocument(documentId);
    return ResponseEntity.noContent().build();
  }
}
