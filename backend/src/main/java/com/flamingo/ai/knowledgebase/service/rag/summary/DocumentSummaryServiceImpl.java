package com.flamingo.ai.knowledgebase.service.rag.summary;

import com.flamingo.ai.knowledgebase.agent.DocumentSummaryAgent;
import com.flamingo.ai.knowledgebase.config.RagConfig;
import io.micrometer.core.annotation.Timed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of {@link DocumentSummaryService} using an LLM agent. */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentSummaryServiceImpl implements DocumentSummaryService {

  static final String ELLIPSIS = "…";

  private final DocumentSummaryAgent documentSummaryAgent;
  private final RagConfig ragConfig;

  @Override
  @Timed(value = "document.summary", description = "Time to generate document summary")
  public String generateSummary(String fileName, String fullText) {
    if (fullText == null || fullText.isBlank()) {
      log.warn("Cannot summarize '{}': empty content", fileName);
      return "";
    }
    String input = truncate(fullText, ragConfig.getSummary().getMaxInputChars());
    try {
      log.debug(
          "Summarizing '{}' (input {} chars, sent {})",
          fileName,
          fullText.length(),
          input.length());
      String summary = documentSummaryAgent.summarize(fileName, input);
      return summary == null ? "" : summary.trim();
    } catch (RuntimeException e) {
      log.warn("Summary generation failed for '{}': {}", fileName, e.getMessage());
      return "";
    }
  }

  static String truncate(String text, int maxChars) {
    if (text.length() <= maxChars) {
      return text;
    }
    return text.substring(0, maxChars).stripTrailing() + ELLIPSIS;
  }
}
