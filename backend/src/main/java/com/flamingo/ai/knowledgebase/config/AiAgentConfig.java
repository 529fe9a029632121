package com.flamingo.ai.knowledgebase.config;

import com.flamingo.ai.knowledgebase.agent.DocumentSummaryAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for reusable AI agents using LangChain4j AI Services.
 *
 * <p>Pattern: Define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Summarizes document text on the first markdown request. */
  @Bean
  public DocumentSummaryAgent documentSummaryAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(DocumentSummaryAgent.class).chatModel(textChatModel).build();
  }
}
