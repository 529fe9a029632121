package com.flamingo.ai.knowledgebase.service.rag.parsing;

import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/** Plain text: one text block per blank-line separated paragraph, all on page 0. */
@Service
@Order(60)
public class PlainTextParser implements DocumentParser {

  static final String ENGINE = "text";

  @Override
  public String engine() {
    return ENGINE;
  }

  @Override
  public boolean supports(ParsingContext context) {
    return SupportedFileTypes.PLAIN_TEXT.contains(context.extension());
  }

  @Override
  public ParseResult tryParse(ParsingContext context) {
    String text = TextDecoding.decode(context.bytes());
    return new ParseResult(text, paragraphs(text), ENGINE, "1");
  }

  /** Splits text into paragraph blocks on blank lines. */
  static List<Block> paragraphs(String text) {
    List<Block> blocks = new ArrayList<>();
    for (String paragraph : text.split("\\r?\\n\\s*\\r?\\n")) {
      String p = paragraph.strip();
      if (!p.isEmpty()) {
        blocks.add(Block.text(BlockType.TEXT, p, 0));
      }
    }
    return blocks;
  }
}
