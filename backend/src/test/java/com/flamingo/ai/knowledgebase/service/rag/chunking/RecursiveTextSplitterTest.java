package com.flamingo.ai.knowledgebase.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("Text splitting helpers")
class RecursiveTextSplitterTest {

  @Test
  @DisplayName("should keep text within budget as one piece")
  void shouldKeepShortText() {
    assertThat(RecursiveTextSplitter.split("short paragraph", 100))
        .containsExactly("short paragraph");
  }

  @Test
  @DisplayName("should split on paragraph breaks and respect the budget")
  void shouldSplitOnParagraphs() {
    // Given
    String paragraph = "word ".repeat(40).strip();
    String text = paragraph + "\n\n" + paragraph + "\n\n" + paragraph;

    // When
    List<String> parts = RecursiveTextSplitter.split(text, 80);

    // Then
    assertThat(parts).hasSizeGreaterThan(1);
    assertThat(parts)
        .allSatisfy(p -> assertThat(TokenEstimator.estimate(p)).isLessThanOrEqualTo(80));
    assertThat(String.join(" ", parts).replace("\n\n", " ")).contains(paragraph);
  }

  @Test
  @DisplayName("should fall back to overlapping windows without separators")
  void shouldForceSplitWithOverlap() {
    // Given
    String text = "a".repeat(1000);

    // When
    List<String> parts = RecursiveTextSplitter.forceSplit(text, 100, 10);

    // Then
    assertThat(parts.get(0)).hasSize(300);
    assertThat(parts).hasSize(4);
    assertThat(String.join("", parts).length()).isEqualTo(1000 + 3 * 30);
  }

  @ParameterizedTest
  @ValueSource(
      strings = {"# Overview", "第三章 系统设计", "2.1 Storage layout", "一、背景", "References", "目录"})
  @DisplayName("should recognise heading-like lines")
  void shouldDetectPseudoTitles(String line) {
    assertThat(PseudoTitleDetector.isPseudoTitle(line, 64)).isTrue();
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "This sentence ends with a period but is long enough to be body text.",
        "1. Install the agent;",
        "plain words",
        "Introduction\nsecond line",
        ""
      })
  @DisplayName("should reject body text")
  void shouldRejectBodyText(String line) {
    assertThat(PseudoTitleDetector.isPseudoTitle(line, 64)).isFalse();
  }

  @Test
  @DisplayName("should reject headings over the length limit")
  void shouldRejectLongHeading() {
    assertThat(PseudoTitleDetector.isPseudoTitle("1. " + "x".repeat(80), 64)).isFalse();
  }
}
