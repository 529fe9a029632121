package com.flamingo.ai.knowledgebase.service.rag.parsing;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import com.flamingo.ai.knowledgebase.exception.ParsingException;
import com.flamingo.ai.knowledgebase.service.storage.BlobStore;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import java.io.IOException;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * First PDF backend: submits the stored file to the hosted MinerU service by presigned URL, polls
 * the task and reads the result archive. Skipped when no API token is configured.
 */
@Service
@Order(10)
@RequiredArgsConstructor
@Slf4j
public class MineruCloudParser implements DocumentParser {

  static final String ENGINE = "mineru-cloud";

  private final MineruCloudClient client;
  private final MineruArtifactReader artifactReader;
  private final BlobStore blobStore;
  private final RagConfig ragConfig;

  @Override
  public String engine() {
    return ENGINE;
  }

  @Override
  public boolean supports(ParsingContext context) {
    return context.isPdf() && client.isConfigured();
  }

  @Override
  @CircuitBreaker(name = "mineru", fallbackMethod = "parseFallback")
  public ParseResult tryParse(ParsingContext context) {
    RagConfig.Parsing.MineruCloud config = ragConfig.getParsing().getMineruCloud();
    String fileUrl =
        blobStore.presignedUrl(context.storagePath(), ragConfig.getStorage().getPresignExpiry());

    String taskId = client.submit(fileUrl);
    log.info("Submitted extraction task {} for document {}", taskId, context.documentId());

    String artifactUrl = awaitArtifact(taskId, config.getPollInterval(), config.getTimeout());
    byte[] archive = client.download(artifactUrl);
    if (archive == null || archive.length == 0) {
      throw new ParsingException(ENGINE, "Empty result archive for task " + taskId);
    }
    try {
      MineruArtifactReader.Artifact artifact = artifactReader.read(archive);
      return new ParseResult(
          artifact.markdown(), artifact.blocks(), ENGINE, config.getModelVersion());
    } catch (IOException e) {
      throw new ParsingException(ENGINE, "Unreadable result archive: " + e.getMessage(), e);
    }
  }

  private String awaitArtifact(String taskId, Duration interval, Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    int polls = 0;
    while (System.nanoTime() < deadline) {
      sleep(interval);
      MineruCloudClient.TaskState state = client.poll(taskId);
      polls++;
      if (state.isDone()) {
        log.info("Task {} finished after {} polls", taskId, polls);
        return state.artifactUrl();
      }
      if (state.isFailed()) {
        throw new ParsingException(ENGINE, "Task " + taskId + " failed: " + state.message());
      }
      log.debug("Task {} state={} (poll {})", taskId, state.state(), polls);
    }
    throw new ParsingException(ENGINE, "Task " + taskId + " timed out after " + timeout);
  }

  private static void sleep(Duration interval) {
    if (interval.isZero() || interval.isNegative()) {
      return;
    }
    try {
      Thread.sleep(interval.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ParsingException(ENGINE, "Interrupted while waiting for extraction task", e);
    }
  }

  @SuppressWarnings("unused")
  private ParseResult parseFallback(ParsingContext context, Throwable t) {
    if (t instanceof ParsingException parsingException) {
      throw parsingException;
    }
    throw new ParsingException(ENGINE, "Hosted extraction unavailable: " + t.getMessage(), t);
  }
}
