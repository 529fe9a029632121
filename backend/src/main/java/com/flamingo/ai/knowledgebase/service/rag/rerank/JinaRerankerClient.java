package com.flamingo.ai.knowledgebase.service.rag.rerank;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.knowledgebase.config.RagConfig;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for a Jina-compatible rerank endpoint. Encapsulates all WebClient communication with
 * the reranking service.
 */
@Component
@Slf4j
public class JinaRerankerClient {

  private final WebClient webClient;
  private final RagConfig.Rerank config;

  public JinaRerankerClient(RagConfig ragConfig) {
    this.config = ragConfig.getRerank();
    this.webClient =
        WebClient.builder()
            .baseUrl(config.getUrl())
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    log.info("Reranker client initialized: url={}, model={}", config.getUrl(), config.getModel());
  }

  /** True when an API key is configured. */
  public boolean isConfigured() {
    return config.getApiKey() != null && !config.getApiKey().isBlank();
  }

  /**
   * Scores every text against the query.
   *
   * @param query the search query
   * @param texts the candidate texts to score
   * @return one result per scored text, in the order returned by the service
   */
  public List<RerankResult> rerank(String query, List<String> texts) {
    var request = new JinaRerankRequest(config.getModel(), query, texts, texts.size(), false);
    RerankResponse response =
        webClient
            .post()
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(RerankResponse.class)
            .timeout(config.getTimeout())
            .block();
    if (response == null || response.results() == null) {
      throw new IllegalStateException("Reranker returned no results");
    }
    return response.results();
  }

  record JinaRerankRequest(
      String model,
      String query,
      List<String> documents,
      @JsonProperty("top_n") int topN,
      @JsonProperty("return_documents") boolean returnDocuments) {}

  record RerankResponse(List<RerankResult> results) {}

  /** Rerank response element. */
  public record RerankResult(int index, @JsonProperty("relevance_score") double relevanceScore) {}
}
