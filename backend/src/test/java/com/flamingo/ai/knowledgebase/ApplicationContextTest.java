package com.flamingo.ai.knowledgebase;

import static org.assertj.core.api.Assertions.assertThat;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import com.flamingo.ai.knowledgebase.service.document.DocumentMarkdownService;
import com.flamingo.ai.knowledgebase.service.document.DocumentService;
import com.flamingo.ai.knowledgebase.service.rag.DocumentProcessingService;
import com.flamingo.ai.knowledgebase.service.rag.parsing.DocumentParser;
import com.flamingo.ai.knowledgebase.service.rag.parsing.DocumentParserChain;
import com.flamingo.ai.knowledgebase.service.rag.search.HybridSearchService;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Verifies the application context loads with every external service (LLMs, Elasticsearch, object
 * storage) mocked.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean(name = "textChatModel")
  private ChatModel textChatModel;

  @MockitoBean(name = "visionChatModel")
  private ChatModel visionChatModel;

  @MockitoBean private EmbeddingModel embeddingModel;
  @MockitoBean private ElasticsearchClient elasticsearchClient;
  @MockitoBean private S3Client s3Client;
  @MockitoBean private S3Presigner s3Presigner;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(DocumentService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentProcessingService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentMarkdownService.class)).isNotNull();
    assertThat(applicationContext.getBean(DocumentParserChain.class)).isNotNull();
    assertThat(applicationContext.getBean(HybridSearchService.class)).isNotNull();
  }

  @Test
  @DisplayName("Every parser backend should be registered")
  void parserBackendsShouldBeRegistered() {
    assertThat(applicationContext.getBeansOfType(DocumentParser.class)).hasSizeGreaterThan(5);
  }
}
