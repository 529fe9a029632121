package com.flamingo.ai.knowledgebase.service.rag.parsing;

import com.flamingo.ai.knowledgebase.exception.ParsingException;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs the ordered parser backends until one yields a non-empty result.
 *
 * <p>Backends that do not support the file are skipped. A backend that throws or returns nothing
 * hands over to the next one; only when every candidate failed does the chain throw.
 */
@Service
@Slf4j
public class DocumentParserChain {

  private final List<DocumentParser> parsers;
  private final MeterRegistry meterRegistry;

  /** Spring injects the parsers sorted by their {@code @Order}. */
  public DocumentParserChain(List<DocumentParser> parsers, MeterRegistry meterRegistry) {
    this.parsers = List.copyOf(parsers);
    this.meterRegistry = meterRegistry;
  }

  /**
   * Parses the file with the first backend that succeeds.
   *
   * @param context file being parsed
   * @return the first non-empty result
   * @throws ParsingException if no backend supports the file or all of them failed
   */
  @Timed(value = "rag.parse", description = "Time to parse a document through the parser chain")
  public ParseResult parse(ParsingContext context) {
    ParsingException lastError = null;
    int attempted = 0;

    for (DocumentParser parser : parsers) {
      if (!parser.supports(context)) {
        continue;
      }
      if (attempted > 0) {
        meterRegistry.counter("parser.fallback", "engine", parser.engine()).increment();
      }
      attempted++;
      try {
        log.info("Parsing {} with {}", context.fileName(), parser.engine());
        ParseResult result = parser.tryParse(context);
        if (result != null && !result.isEmpty()) {
          log.info(
              "Parser {} produced {} blocks, {} markdown chars for document {}",
              parser.engine(),
              result.blocks().size(),
              result.markdown().length(),
              context.documentId());
          return result;
        }
        lastError = new ParsingException(parser.engine(), "Parser returned no content");
        log.warn("Parser {} returned no content for {}", parser.engine(), context.documentId());
      } catch (ParsingException e) {
        lastError = e;
        log.warn(
            "Parser {} failed for {}: {}", parser.engine(), context.documentId(), e.getMessage());
      } catch (RuntimeException e) {
        lastError = new ParsingException(parser.engine(), e.getMessage(), e);
        log.warn(
            "Parser {} failed unexpectedly for {}: {}",
            parser.engine(),
            context.documentId(),
            e.getMessage(),
            e);
      }
    }

    if (attempted == 0) {
      throw new ParsingException("none", "No parser supports file " + context.fileName());
    }
    throw new ParsingException(
        lastError.getEngine(),
        "All " + attempted + " parsers failed; last error from " + lastError.getEngine() + ": "
            + lastError.getMessage(),
        lastError);
  }
}
