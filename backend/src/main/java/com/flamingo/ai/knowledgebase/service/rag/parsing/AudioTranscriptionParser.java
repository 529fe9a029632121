package com.flamingo.ai.knowledgebase.service.rag.parsing;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import com.flamingo.ai.knowledgebase.exception.ParsingException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

/** Audio uploads, transcribed through the OpenAI-compatible transcription endpoint. */
@Service
@Order(70)
@Slf4j
public class AudioTranscriptionParser implements DocumentParser {

  static final String ENGINE = "transcription";

  private final WebClient webClient;
  private final RagConfig.Parsing.Audio config;

  @Autowired
  public AudioTranscriptionParser(
      RagConfig ragConfig,
      @Value("${langchain4j.openai.base-url:https://api.openai.com/v1}") String baseUrl,
      @Value("${langchain4j.openai.api-key:}") String apiKey) {
    this(ragConfig, baseUrl, apiKey, WebClient.builder());
  }

  AudioTranscriptionParser(
      RagConfig ragConfig, String baseUrl, String apiKey, WebClient.Builder webClientBuilder) {
    this.config = ragConfig.getParsing().getAudio();
    this.webClient =
        webClientBuilder
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
            .build();
  }

  @Override
  public String engine() {
    return ENGINE;
  }

  @Override
  public boolean supports(ParsingContext context) {
    return config.isEnabled() && SupportedFileTypes.AUDIO.contains(context.extension());
  }

  @Override
  @CircuitBreaker(name = "transcription", fallbackMethod = "transcribeFallback")
  public ParseResult tryParse(ParsingContext context) {
    MultipartBodyBuilder body = new MultipartBodyBuilder();
    body.part("file", new ByteArrayResource(context.bytes()))
        .filename(context.fileName())
        .contentType(MediaType.parseMediaType(context.mimeType()));
    body.part("model", config.getModel());
    body.part("response_format", "text");

    String transcript =
        webClient
            .post()
            .uri("/audio/transcriptions")
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(body.build()))
            .retrieve()
            .bodyToMono(String.class)
            .timeout(config.getTimeout())
            .block();
    if (transcript == null || transcript.isBlank()) {
      throw new ParsingException(ENGINE, "Empty transcript for " + context.fileName());
    }
    log.debug("Transcribed {} ({} chars)", context.fileName(), transcript.length());
    return new ParseResult(
        transcript, PlainTextParser.paragraphs(transcript), ENGINE, config.getModel());
  }

  @SuppressWarnings("unused")
  private ParseResult transcribeFallback(ParsingContext context, Throwable t) {
    if (t instanceof ParsingException parsingException) {
      throw parsingException;
    }
    throw new ParsingException(ENGINE, "Transcription failed: " + t.getMessage(), t);
  }
}
