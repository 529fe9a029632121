package com.flamingo.ai.knowledgebase.domain.enums;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("DocumentStatus Tests")
class DocumentStatusTest {

  @ParameterizedTest(name = "{0} -> {1} allowed: {2}")
  @CsvSource({
    "UPLOADED, PARSING, true",
    "UPLOADED, EMBEDDING, true",
    "UPLOADED, READY, false",
    "PARSING, PARSED, true",
    "PARSING, READY, false",
    "PARSED, EMBEDDING, true",
    "EMBEDDING, READY, true",
    "EMBEDDING, PARSING, false",
    "READY, PARSING, true",
    "READY, FAILED, false",
    "FAILED, PARSING, true",
    "FAILED, UPLOADED, true"
  })
  @DisplayName("Should follow the transition table")
  void shouldFollowTransitionTable(DocumentStatus from, DocumentStatus to, boolean allowed) {
    assertThat(from.canTransitionTo(to)).isEqualTo(allowed);
  }

  @Test
  @DisplayName("Should list every status that may enter PARSING")
  void shouldListPredecessors() {
    assertThat(DocumentStatus.predecessorsOf(DocumentStatus.PARSING))
        .containsExactlyInAnyOrder(
            DocumentStatus.UPLOADED, DocumentStatus.READY, DocumentStatus.FAILED);
  }

  @Test
  @DisplayName("Should report pipeline-owned statuses as running")
  void shouldReportRunningStatuses() {
    assertThat(DocumentStatus.PARSING.isRunning()).isTrue();
    assertThat(DocumentStatus.EMBEDDING.isRunning()).isTrue();
    assertThat(DocumentStatus.READY.isRunning()).isFalse();
    assertThat(DocumentStatus.FAILED.isRunning()).isFalse();
  }
}
