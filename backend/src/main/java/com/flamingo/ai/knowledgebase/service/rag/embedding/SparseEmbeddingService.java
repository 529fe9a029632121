package com.flamingo.ai.knowledgebase.service.rag.embedding;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Sparse lexical vectors. Uses a remote BGE-M3/SPLADE style {@code /encode} service when one is
 * configured, otherwise TF-IDF computed over the batch being encoded.
 */
@Service
@Slf4j
public class SparseEmbeddingService {

  private static final Pattern TOKEN =
      Pattern.compile("[\\w\\u4e00-\\u9fff]+", Pattern.UNICODE_CHARACTER_CLASS);

  private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
      new ParameterizedTypeReference<>() {};

  private final RagConfig.Sparse config;
  private final MeterRegistry meterRegistry;
  private final WebClient webClient;

  public SparseEmbeddingService(RagConfig ragConfig, MeterRegistry meterRegistry) {
    this.config = ragConfig.getSparse();
    this.meterRegistry = meterRegistry;
    this.webClient = WebClient.builder().build();
  }

  /**
   * Encodes a batch of texts. With the local encoder, document frequencies come from this batch.
   *
   * @param texts texts to encode
   * @return one vector per text, in input order
   */
  @Timed(value = "embedding.sparse", description = "Time to encode a batch of sparse vectors")
  @CircuitBreaker(name = "sparseEncoder", fallbackMethod = "encodeLocallyFallback")
  public List<SparseVector> encode(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    if (!isRemoteConfigured()) {
      return encodeLocally(texts, config.getMaxTerms());
    }
    return encodeRemotely(texts);
  }

  /** Encodes a query exactly like a one-element batch. */
  public SparseVector encodeQuery(String query) {
    List<SparseVector> vectors = encode(List.of(query));
    return vectors.isEmpty() ? SparseVector.empty() : vectors.get(0);
  }

  boolean isRemoteConfigured() {
    String url = config.getEncoderUrl();
    return url != null && (url.startsWith("http://") || url.startsWith("https://"));
  }

  private List<SparseVector> encodeRemotely(List<String> texts) {
    String url = config.getEncoderUrl().replaceAll("/+$", "");
    if (!url.endsWith("/encode")) {
      url = url + "/encode";
    }
    Map<String, Object> response =
        webClient
            .post()
            .uri(url)
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("texts", texts, "return_sparse", true))
            .retrieve()
            .bodyToMono(MAP_TYPE)
            .timeout(config.getTimeout())
            .block();
    if (response == null) {
      throw new IllegalStateException("Empty response from sparse encoder");
    }
    Object items = response.get("data");
    if (items == null) {
      items = response.getOrDefault("sparse", response.get("results"));
    }
    if (!(items instanceof List<?> list) || list.size() != texts.size()) {
      throw new IllegalStateException("Sparse encoder returned an unexpected payload");
    }
    List<SparseVector> vectors = new ArrayList<>(list.size());
    for (Object item : list) {
      vectors.add(SparseVector.topTerms(parseRemoteItem(item), config.getMaxTerms()));
    }
    return vectors;
  }

  /** Reads {@code {indices, values}}, a {@code {id: weight}} map, or a list of pairs. */
  static Map<String, Float> parseRemoteItem(Object item) {
    Map<String, Float> weights = new HashMap<>();
    if (item instanceof Map<?, ?> map) {
      if (map.get("indices") instanceof List<?> indices
          && map.get("values") instanceof List<?> values) {
        for (int i = 0; i < Math.min(indices.size(), values.size()); i++) {
          if (values.get(i) instanceof Number n) {
            weights.put(String.valueOf(indices.get(i)), n.floatValue());
          }
        }
      } else {
        map.forEach(
            (k, v) -> {
              if (v instanceof Number n && String.valueOf(k).matches("\\d+")) {
                weights.put(String.valueOf(k), n.floatValue());
              }
            });
      }
    } else if (item instanceof List<?> pairs) {
      for (Object pair : pairs) {
        if (pair instanceof List<?> p && p.size() >= 2 && p.get(1) instanceof Number n) {
          weights.put(String.valueOf(p.get(0)), n.floatValue());
        } else if (pair instanceof Map<?, ?> m) {
          weights.putAll(parseRemoteItem(m));
        }
      }
    }
    return weights;
  }

  /**
   * TF-IDF over the given batch: {@code tf * (ln((n + 1) / (df + 1)) + 1)}, keeping the heaviest
   * {@code maxTerms} terms.
   */
  static List<SparseVector> encodeLocally(List<String> texts, int maxTerms) {
    List<List<String>> tokenized = new ArrayList<>(texts.size());
    Map<String, Integer> documentFrequency = new HashMap<>();
    for (String text : texts) {
      List<String> tokens = tokenize(text);
      tokenized.add(tokens);
      for (String term : new HashSet<>(tokens)) {
        documentFrequency.merge(term, 1, Integer::sum);
      }
    }

    int n = texts.size();
    List<SparseVector> vectors = new ArrayList<>(n);
    for (List<String> tokens : tokenized) {
      if (tokens.isEmpty()) {
        vectors.add(SparseVector.empty());
        continue;
      }
      Map<String, Integer> termFrequency = new HashMap<>();
      tokens.forEach(t -> termFrequency.merge(t, 1, Integer::sum));

      Map<String, Float> weights = new HashMap<>();
      for (Map.Entry<String, Integer> entry : termFrequency.entrySet()) {
        double tf = (double) entry.getValue() / tokens.size();
        double idf = Math.log((n + 1.0) / (documentFrequency.get(entry.getKey()) + 1.0)) + 1.0;
        double weight = tf * idf;
        if (weight > 1e-6) {
          weights.merge(termId(entry.getKey()), (float) weight, Float::sum);
        }
      }
      vectors.add(SparseVector.topTerms(weights, maxTerms));
    }
    return vectors;
  }

  public static List<String> tokenize(String text) {
    List<String> tokens = new ArrayList<>();
    if (text == null) {
      return tokens;
    }
    Matcher m = TOKEN.matcher(text.toLowerCase(Locale.ROOT));
    while (m.find()) {
      tokens.add(m.group());
    }
    return tokens;
  }

  /** Stable term id: the first 32 bits of the term's MD5, as an unsigned decimal. */
  static String termId(String term) {
    String hex = DigestUtils.md5Hex(term).substring(0, 8);
    return Long.toString(Long.parseLong(hex, 16));
  }

  @SuppressWarnings("unused")
  private List<SparseVector> encodeLocallyFallback(List<String> texts, Throwable t) {
    log.warn("Sparse encoder unavailable, using local TF-IDF: {}", t.getMessage());
    meterRegistry.counter("embedding.sparse.fallback").increment();
    return encodeLocally(texts, config.getMaxTerms());
  }
}
