package com.flamingo.ai.knowledgebase;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the knowledge base backend. */
@SpringBootApplication
public class KnowledgeBaseApplication {

  public static void main(String[] args) {
    SpringApplication.run(KnowledgeBaseApplication.class, args);
  }
}
