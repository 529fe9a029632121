package com.flamingo.ai.knowledgebase.service.rag.summary;

/** Generates short document summaries. */
public interface DocumentSummaryService {

  /**
   * Summarizes document text.
   *
   * @param fileName the document name, given to the model as context
   * @param fullText the document text; truncated before it is sent
   * @return the summary, or an empty string when the text is empty or the model failed
   */
  String generateSummary(String fileName, String fullText);
}
