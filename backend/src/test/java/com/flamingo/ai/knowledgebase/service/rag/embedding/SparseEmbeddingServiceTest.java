package com.flamingo.ai.knowledgebase.service.rag.embedding;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SparseEmbeddingService Tests")
class SparseEmbeddingServiceTest {

  private final SparseEmbeddingService service =
      new SparseEmbeddingService(new RagConfig(), new SimpleMeterRegistry());

  @Test
  @DisplayName("Should weight rare terms above common ones")
  void shouldWeightRareTermsHigher() {
    // When
    List<SparseVector> vectors =
        service.encode(List.of("latency budget", "latency report", "latency"));

    // Then
    Map<String, Float> first = vectors.get(0).weights();
    String latency = SparseEmbeddingService.termId("latency");
    String budget = SparseEmbeddingService.termId("budget");
    assertThat(first).containsKeys(latency, budget);
    assertThat(first.get(budget)).isGreaterThan(first.get(latency));
  }

  @Test
  @DisplayName("Should encode text without terms as the placeholder vector")
  void shouldEncodeEmptyTextAsPlaceholder() {
    assertThat(service.encodeQuery("  ... ")).isEqualTo(SparseVector.empty());
  }

  @Test
  @DisplayName("Should produce the same ids for the same terms in queries and documents")
  void shouldUseStableTermIds() {
    SparseVector query = service.encodeQuery("Budget");

    assertThat(query.weights()).containsOnlyKeys(SparseEmbeddingService.termId("budget"));
  }

  @Test
  @DisplayName("Should read the supported remote payload shapes")
  void shouldParseRemotePayloads() {
    assertThat(
            SparseEmbeddingService.parseRemoteItem(
                Map.of("indices", List.of(7, 9), "values", List.of(0.5, 0.25))))
        .containsEntry("7", 0.5f)
        .containsEntry("9", 0.25f);
    assertThat(SparseEmbeddingService.parseRemoteItem(Map.of("12", 1.0, "word", 2.0)))
        .containsOnlyKeys("12");
    assertThat(SparseEmbeddingService.parseRemoteItem(List.of(List.of(3, 0.75))))
        .containsEntry("3", 0.75f);
  }
}
