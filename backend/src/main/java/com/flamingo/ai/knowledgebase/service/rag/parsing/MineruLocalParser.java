package com.flamingo.ai.knowledgebase.service.rag.parsing;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import com.flamingo.ai.knowledgebase.exception.ParsingException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * Second PDF backend: the self-hosted MinerU {@code /file_parse} API, called synchronously with
 * images returned inline as base64.
 */
@Service
@Order(20)
@Slf4j
public class MineruLocalParser implements DocumentParser {

  static final String ENGINE = "mineru-local";

  private static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
      new ParameterizedTypeReference<>() {};

  private static final Comparator<String> IMAGE_ORDER =
      Comparator.<String>comparingLong(name -> name.chars().filter(c -> c == '/').count())
          .thenComparing(Comparator.naturalOrder());

  private final WebClient webClient;
  private final BlockNormalizer blockNormalizer;
  private final RagConfig.Parsing.MineruLocal config;

  @Autowired
  public MineruLocalParser(RagConfig ragConfig, BlockNormalizer blockNormalizer) {
    this(ragConfig, blockNormalizer, WebClient.builder());
  }

  MineruLocalParser(
      RagConfig ragConfig, BlockNormalizer blockNormalizer, WebClient.Builder webClientBuilder) {
    this.config = ragConfig.getParsing().getMineruLocal();
    this.blockNormalizer = blockNormalizer;
    this.webClient =
        webClientBuilder
            .baseUrl(config.getBaseUrl())
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(256 * 1024 * 1024))
            .build();
  }

  @Override
  public String engine() {
    return ENGINE;
  }

  @Override
  public boolean supports(ParsingContext context) {
    return context.isPdf() && config.isEnabled();
  }

  @Override
  @CircuitBreaker(name = "mineru", fallbackMethod = "parseFallback")
  public ParseResult tryParse(ParsingContext context) {
    MultipartBodyBuilder body = new MultipartBodyBuilder();
    body.part("files", new ByteArrayResource(context.bytes()))
        .filename(context.fileName())
        .contentType(MediaType.APPLICATION_PDF);
    body.part("return_md", "true");
    body.part("return_content_list", "true");
    body.part("return_images", "true");
    body.part("lang_list", "ch");
    body.part("backend", "pipeline");

    Map<String, Object> response =
        webClient
            .post()
            .uri("/file_parse")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(body.build()))
            .retrieve()
            .bodyToMono(MAP_TYPE)
            .timeout(config.getTimeout())
            .block();
    if (response == null) {
      throw new ParsingException(ENGINE, "Empty response from /file_parse");
    }
    return toParseResult(response);
  }

  /** Converts a {@code /file_parse} response into blocks with images attached. */
  ParseResult toParseResult(Map<String, Object> response) {
    Map<String, Object> result = firstResult(response);
    String markdown = firstString(result, "markdown", "md_content", "md");
    List<Block> blocks = blockNormalizer.extractBlocks(result);
    ImageBytesInjector.inject(blocks, decodeImages(result.get("images")));
    Object version = response.getOrDefault("version", "pipeline");
    return new ParseResult(markdown, blocks, ENGINE, String.valueOf(version));
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> firstResult(Map<String, Object> response) {
    Object results = response.get("results");
    Object first = null;
    if (results instanceof List<?> list && !list.isEmpty()) {
      first = list.get(0);
    } else if (results instanceof Map<?, ?> map && !map.isEmpty()) {
      first = map.values().iterator().next();
    }
    if (first instanceof Map<?, ?> firstMap) {
      return new LinkedHashMap<>((Map<String, Object>) firstMap);
    }
    return response;
  }

  private static Map<String, byte[]> decodeImages(Object images) {
    Map<String, byte[]> decoded = new TreeMap<>(IMAGE_ORDER);
    if (!(images instanceof Map<?, ?> imageMap)) {
      return decoded;
    }
    for (Map.Entry<?, ?> entry : imageMap.entrySet()) {
      if (entry.getValue() instanceof String encoded) {
        byte[] bytes = BlockNormalizer.decodeBase64(encoded);
        if (bytes != null) {
          decoded.put(String.valueOf(entry.getKey()), bytes);
        }
      }
    }
    return decoded;
  }

  private static String firstString(Map<String, Object> map, String... keys) {
    for (String key : keys) {
      if (map.get(key) instanceof String value && !value.isBlank()) {
        return value;
      }
    }
    return "";
  }

  @SuppressWarnings("unused")
  private ParseResult parseFallback(ParsingContext context, Throwable t) {
    if (t instanceof ParsingException parsingException) {
      throw parsingException;
    }
    throw new ParsingException(
        ENGINE, "Local extraction service unavailable: " + t.getMessage(), t);
  }
}
