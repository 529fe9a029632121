package com.flamingo.ai.knowledgebase.service.document;

import com.flamingo.ai.knowledgebase.domain.entity.Chunk;
import com.flamingo.ai.knowledgebase.domain.entity.Document;
import java.util.List;
import java.util.UUID;
import org.springframework.web.multipart.MultipartFile;

/** Service interface for the document registry. */
public interface DocumentService {

  /**
   * Registers an upload in a collection. Identical content in the same collection returns the
   * existing document; content already processed elsewhere is cloned instead of parsed.
   *
   * @param collectionId the collection
   * @param file the uploaded file
   * @return the document and whether it already existed
   * @throws com.flamingo.ai.knowledgebase.exception.UnsupportedFileTypeException for unknown
   *     extensions
   */
  Registration register(String collectionId, MultipartFile file);

  /**
   * Starts processing an UPLOADED or FAILED document. Any other status is left alone.
   *
   * @param documentId the document ID
   * @return the document as it is now
   */
  Document process(UUID documentId);

  /**
   * Discards the document's chunks and vectors and processes it again.
   *
   * @param documentId the document ID
   * @return the document, reset to UPLOADED
   * @throws com.flamingo.ai.knowledgebase.exception.InvalidDocumentStateException while the
   *     document is being processed
   */
  Document reparse(UUID documentId);

  /**
   * Gets a document by ID.
   *
   * @param documentId the document ID
   * @return the document
   * @throws com.flamingo.ai.knowledgebase.exception.DocumentNotFoundException if not found
   */
  Document getDocument(UUID documentId);

  /**
   * Gets all documents of a collection, newest first.
   *
   * @param collectionId the collection
   * @return list of documents
   */
  List<Document> getDocumentsByCollection(String collectionId);

  /**
   * Gets the chunks of a document in index order.
   *
   * @param documentId the document ID
   * @param activeOnly exclude chunks retired by a reparse
   * @return chunks, parents included
   */
  List<Chunk> getChunks(UUID documentId, boolean activeOnly);

  /**
   * Deletes a document with its chunks, vectors and stored files.
   *
   * @param documentId the document ID
   */
  void deleteDocument(UUID documentId);

  /**
   * Outcome of {@link #register}.
   *
   * @param document the registered document
   * @param deduplicated true when the same content was already registered in the collection
   */
  record Registration(Document document, boolean deduplicated) {}
}
