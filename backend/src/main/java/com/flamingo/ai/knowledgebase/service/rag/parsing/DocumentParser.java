package com.flamingo.ai.knowledgebase.service.rag.parsing;

/**
 * One backend of the parser chain.
 *
 * <p>Implementations are format-specific (PDF via MinerU or PDFBox, Office via Tika,
 * Markdown, …).
 * They must be stateless so a single instance can be shared across concurrent document-processing
 * threads. A parser only parses: it does not upload images, chunk or embed.
 *
 * <p>Chain order is given by {@link org.springframework.core.annotation.Order} on the
 * implementation; lower runs first.
 */
public interface DocumentParser {

  /**
   * Name recorded on the document as its parser engine.
   *
   * @return engine name, e.g. {@code mineru-cloud}
   */
  String engine();

  /**
   * Returns {@code true} if this parser is enabled and can handle the file.
   *
   * @param context file being parsed
   * @return {@code true} if the chain should try this parser
   */
  boolean supports(ParsingContext context);

  /**
   * Parses the file into normalized blocks.
   *
   * @param context file being parsed
   * @return parse result; the chain treats an empty result as a failure
   * @throws com.flamingo.ai.knowledgebase.exception.ParsingException when the backend fails
   */
  ParseResult tryParse(ParsingContext context);
}
