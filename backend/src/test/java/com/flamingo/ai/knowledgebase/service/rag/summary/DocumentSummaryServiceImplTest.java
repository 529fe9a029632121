package com.flamingo.ai.knowledgebase.service.rag.summary;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.knowledgebase.agent.DocumentSummaryAgent;
import com.flamingo.ai.knowledgebase.config.RagConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("DocumentSummaryServiceImpl")
class DocumentSummaryServiceImplTest {

  @Mock private DocumentSummaryAgent documentSummaryAgent;

  private RagConfig ragConfig;
  private DocumentSummaryServiceImpl service;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    service = new DocumentSummaryServiceImpl(documentSummaryAgent, ragConfig);
  }

  @Test
  @DisplayName("should return the trimmed agent summary")
  void shouldSummarize() {
    // Given
    when(documentSummaryAgent.summarize("guide.md", "Install the agent."))
        .thenReturn("  The guide covers installation.\n");

    // When
    String summary = service.generateSummary("guide.md", "Install the agent.");

    // Then
    assertThat(summary).isEqualTo("The guide covers installation.");
  }

  @Test
  @DisplayName("should truncate long input before calling the agent")
  void shouldTruncateInput() {
    // Given
    ragConfig.getSummary().setMaxInputChars(10);
    when(documentSummaryAgent.summarize(anyString(), anyString())).thenReturn("short");

    // When
    service.generateSummary("long.txt", "abcdefghij klmnop");

    // Then
    verify(documentSummaryAgent).summarize(eq("long.txt"), eq("abcdefghij…"));
  }

  @Test
  @DisplayName("should skip the agent for empty text")
  void shouldSkipEmptyText() {
    assertThat(service.generateSummary("empty.txt", "   ")).isEmpty();
    verifyNoInteractions(documentSummaryAgent);
  }

  @Test
  @DisplayName("should return empty when the agent fails")
  void shouldSwallowAgentFailure() {
    // Given
    when(documentSummaryAgent.summarize(anyString(), anyString()))
        .thenThrow(new IllegalStateException("rate limited"));

    // When / Then
    assertThat(service.generateSummary("a.md", "text")).isEmpty();
  }
}
