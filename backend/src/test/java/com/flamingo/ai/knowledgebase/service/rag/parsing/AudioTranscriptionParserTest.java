package com.flamingo.ai.knowledgebase.service.rag.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import com.flamingo.ai.knowledgebase.exception.ParsingException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

@DisplayName("AudioTranscriptionParser Tests")
class AudioTranscriptionParserTest {

  private final AtomicReference<ClientRequest> lastRequest = new AtomicReference<>();
  private RagConfig ragConfig;
  private ParsingContext context;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    ragConfig.getParsing().getAudio().setEnabled(true);
    context =
        new ParsingContext(
            UUID.randomUUID(), "standup.mp3", "rag/col-1/doc/standup.mp3", new byte[] {1, 2});
  }

  private AudioTranscriptionParser parserReturning(String transcript) {
    WebClient.Builder builder =
        WebClient.builder()
            .exchangeFunction(
                request -> {
                  lastRequest.set(request);
                  return Mono.just(
                      ClientResponse.create(HttpStatus.OK)
                          .header(HttpHeaders.CONTENT_TYPE, MediaType.TEXT_PLAIN_VALUE)
                          .body(transcript)
                          .build());
                });
    return new AudioTranscriptionParser(ragConfig, "http://llm.local/v1", "sk-test", builder);
  }

  @Test
  @DisplayName("Should take audio files only while enabled")
  void shouldSupportEnabledAudioOnly() {
    AudioTranscriptionParser parser = parserReturning("");
    ParsingContext pdf =
        new ParsingContext(UUID.randomUUID(), "a.pdf", "rag/a.pdf", new byte[] {1});

    assertThat(parser.supports(context)).isTrue();
    assertThat(parser.supports(pdf)).isFalse();

    ragConfig.getParsing().getAudio().setEnabled(false);
    assertThat(parser.supports(context)).isFalse();
  }

  @Test
  @DisplayName("Should post the file to the transcription endpoint and split the transcript")
  void shouldTranscribe() {
    // Given
    AudioTranscriptionParser parser =
        parserReturning("Yesterday we shipped search.\n\nToday we fix the reranker.");

    // When
    ParseResult result = parser.tryParse(context);

    // Then
    ClientRequest request = lastRequest.get();
    assertThat(request.url().toString()).isEqualTo("http://llm.local/v1/audio/transcriptions");
    assertThat(request.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer sk-test");
    assertThat(request.headers().getContentType())
        .isNotNull()
        .matches(type -> type.isCompatibleWith(MediaType.MULTIPART_FORM_DATA));
    assertThat(result.engine()).isEqualTo("transcription");
    assertThat(result.engineVersion()).isEqualTo("whisper-1");
    assertThat(result.blocks())
        .extracting(Block::getText)
        .containsExactly("Yesterday we shipped search.", "Today we fix the reranker.");
  }

  @Test
  @DisplayName("Should fail on an empty transcript")
  void shouldFailOnEmptyTranscript() {
    AudioTranscriptionParser parser = parserReturning("   ");

    assertThatThrownBy(() -> parser.tryParse(context))
        .isInstanceOf(ParsingException.class)
        .hasMessageContaining("standup.mp3");
  }
}
