package com.flamingo.ai.knowledgebase.agent;

import dev.langchain4j.service.SystemMessage;
import dev.langchain4j.service.UserMessage;
import dev.langchain4j.service.V;

/**
 * AI agent for generating a short summary of a parsed document.
 *
 * <p>Produces a 150-300 word plain-text summary that is shown next to the reconstructed markdown.
 */
public interface DocumentSummaryAgent {

  @SystemMessage(
      """
        You are a document summarization expert. Generate a concise 150-300 word summary
        of the provided document content. Capture the main topics, key figures and tables,
        and essential conclusions. Write in the language of the document, in paragraph form.
        Do not use markdown headers or bullet points. Do not start with "This document".
        """)
  @UserMessage("""
        Document: {{fileName}}

        Content:
        {{content}}
        """)
  String summarize(@V("fileName") String fileName, @V("content") String content);
}
