package com.flamingo.ai.knowledgebase.service.rag.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.knowledgebase.exception.ParsingException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("DelimitedTextParser Tests")
class DelimitedTextParserTest {

  private final DelimitedTextParser parser = new DelimitedTextParser();

  private static ParsingContext context(String fileName, String content) {
    return new ParsingContext(
        UUID.randomUUID(), fileName, "key", content.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  @DisplayName("Should render a CSV file as one markdown table")
  void shouldRenderCsvAsTable() {
    ParseResult result =
        parser.tryParse(context("people.csv", "name,note\r\nalice,\"says \"\"hi\"\", twice\"\n"));

    assertThat(result.markdown())
        .isEqualTo("| name | note |\n|---|---|\n| alice | says \"hi\", twice |");
    assertThat(result.blocks())
        .extracting(Block::getType)
        .containsExactly(BlockType.TITLE, BlockType.TABLE);
  }

  @Test
  @DisplayName("Should split TSV on tabs and pad short rows")
  void shouldSplitTsv() {
    List<List<String>> rows = DelimitedTextParser.parseRows("a\tb\tc\n1\t2\n", '\t');

    assertThat(rows).containsExactly(List.of("a", "b", "c"), List.of("1", "2"));
    assertThat(DelimitedTextParser.toMarkdownTable(rows)).endsWith("| 1 | 2 |  |");
  }

  @Test
  @DisplayName("Should keep line breaks inside quoted fields")
  void shouldKeepQuotedLineBreaks() {
    List<List<String>> rows = DelimitedTextParser.parseRows("x,\"line1\nline2\"\n", ',');

    assertThat(rows).containsExactly(List.of("x", "line1\nline2"));
  }

  @Test
  @DisplayName("Should fail on a file without rows")
  void shouldFailOnEmptyFile() {
    assertThatThrownBy(() -> parser.tryParse(context("empty.csv", " ,\n\n")))
        .isInstanceOf(ParsingException.class);
  }
}
