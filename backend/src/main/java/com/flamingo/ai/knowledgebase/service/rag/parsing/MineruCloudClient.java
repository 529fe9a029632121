package com.flamingo.ai.knowledgebase.service.rag.parsing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.flamingo.ai.knowledgebase.config.RagConfig;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * HTTP client for the token-based MinerU extraction API. Encapsulates task submission, status
 * polling and artifact download.
 */
@Component
@Slf4j
public class MineruCloudClient {

  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);
  private static final Duration DOWNLOAD_TIMEOUT = Duration.ofSeconds(120);

  private final WebClient webClient;
  private final WebClient downloadClient;
  private final RagConfig.Parsing.MineruCloud config;

  public MineruCloudClient(RagConfig ragConfig) {
    this.config = ragConfig.getParsing().getMineruCloud();
    this.webClient =
        WebClient.builder()
            .baseUrl(stripTrailingSlash(config.getBaseUrl()))
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + config.getToken())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(2 * 1024 * 1024))
            .build();
    this.downloadClient =
        WebClient.builder()
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(256 * 1024 * 1024))
            .build();
  }

  public boolean isConfigured() {
    return config.getToken() != null && !config.getToken().isBlank();
  }

  /**
   * Submits an extraction task for a file reachable at {@code fileUrl}.
   *
   * @return the task id
   */
  public String submit(String fileUrl) {
    var request =
        Map.of(
            "url", fileUrl,
            "model_version", config.getModelVersion(),
            "language", "ch",
            "enable_formula", true,
            "enable_table", true);
    JsonNode response =
        webClient
            .post()
            .uri("/api/v4/extract/task")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(request)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(REQUEST_TIMEOUT)
            .block();
    JsonNode data = unwrapData(response);
    String taskId = firstText(data, "task_id", "id", "taskId");
    if (taskId == null) {
      throw new IllegalStateException("Extraction API returned no task id: " + response);
    }
    return taskId;
  }

  /** Fetches the current state of a task. */
  public TaskState poll(String taskId) {
    JsonNode response =
        webClient
            .get()
            .uri("/api/v4/extract/task/{taskId}", taskId)
            .retrieve()
            .bodyToMono(JsonNode.class)
            .timeout(REQUEST_TIMEOUT)
            .block();
    JsonNode data = unwrapData(response);
    String state = firstText(data, "status", "state");
    return new TaskState(
        state == null ? "" : state.toLowerCase(),
        firstText(data, "full_zip_url", "fullZipUrl", "result_url"),
        firstText(data, "err_msg", "message"));
  }

  /** Downloads the result archive. */
  public byte[] download(String artifactUrl) {
    return downloadClient
        .get()
        .uri(URI.create(artifactUrl))
        .retrieve()
        .bodyToMono(byte[].class)
        .timeout(DOWNLOAD_TIMEOUT)
        .block();
  }

  private static JsonNode unwrapData(JsonNode response) {
    if (response == null) {
      return MissingNode.getInstance();
    }
    JsonNode data = response.get("data");
    return data != null && data.isObject() ? data : response;
  }

  private static String firstText(JsonNode node, String... fields) {
    for (String field : fields) {
      JsonNode value = node.get(field);
      if (value != null && !value.isNull() && !value.asText().isBlank()) {
        return value.asText();
      }
    }
    return null;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }

  /**
   * Task status snapshot.
   *
   * @param state lower-case state reported by the service
   * @param artifactUrl result archive URL once available
   * @param message error message, if any
   */
  public record TaskState(String state, String artifactUrl, String message) {

    public boolean isFailed() {
      return "failed".equals(state) || "error".equals(state) || "failure".equals(state);
    }

    public boolean isDone() {
      return artifactUrl != null;
    }
  }
}
