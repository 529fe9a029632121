package com.flamingo.ai.knowledgebase.service.rag.parsing;

import com.flamingo.ai.knowledgebase.exception.ParsingException;
import java.util.ArrayList;
import java.util.List;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * CSV and TSV files, rendered as one Markdown table block. Quoted fields may contain delimiters,
 * doubled quotes and line breaks.
 */
@Service
@Order(50)
public class DelimitedTextParser implements DocumentParser {

  static final String ENGINE = "delimited";

  @Override
  public String engine() {
    return ENGINE;
  }

  @Override
  public boolean supports(ParsingContext context) {
    return SupportedFileTypes.DELIMITED.contains(context.extension());
  }

  @Override
  public ParseResult tryParse(ParsingContext context) {
    char delimiter = "tsv".equals(context.extension()) ? '\t' : ',';
    List<List<String>> rows = parseRows(TextDecoding.decode(context.bytes()), delimiter);
    if (rows.isEmpty()) {
      throw new ParsingException(ENGINE, "No rows in " + context.fileName());
    }
    String table = toMarkdownTable(rows);
    List<Block> blocks = new ArrayList<>();
    blocks.add(Block.text(BlockType.TITLE, context.fileName(), 0));
    blocks.add(Block.text(BlockType.TABLE, table, 0));
    return new ParseResult(table, blocks, ENGINE, "1");
  }

  static List<List<String>> parseRows(String text, char delimiter) {
    List<List<String>> rows = new ArrayList<>();
    List<String> row = new ArrayList<>();
    StringBuilder field = new StringBuilder();
    boolean quoted = false;

    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quoted) {
        if (c == '"' && i + 1 < text.length() && text.charAt(i + 1) == '"') {
          field.append('"');
          i++;
        } else if (c == '"') {
          quoted = false;
        } else {
          field.append(c);
        }
      } else if (c == '"' && field.length() == 0) {
        quoted = true;
      } else if (c == delimiter) {
        row.add(field.toString().strip());
        field.setLength(0);
      } else if (c == '\n' || c == '\r') {
        if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
          i++;
        }
        row.add(field.toString().strip());
        field.setLength(0);
        addIfNotBlank(rows, row);
        row = new ArrayList<>();
      } else {
        field.append(c);
      }
    }
    if (field.length() > 0 || !row.isEmpty()) {
      row.add(field.toString().strip());
      addIfNotBlank(rows, row);
    }
    return rows;
  }

  private static void addIfNotBlank(List<List<String>> rows, List<String> row) {
    if (row.stream().anyMatch(cell -> !cell.isEmpty())) {
      rows.add(row);
    }
  }

  static String toMarkdownTable(List<List<String>> rows) {
    int columns = rows.stream().mapToInt(List::size).max().orElse(0);
    StringBuilder sb = new StringBuilder();
    for (int r = 0; r < rows.size(); r++) {
      List<String> row = rows.get(r);
      sb.append('|');
      for (int c = 0; c < columns; c++) {
        String cell = c < row.size() ? row.get(c) : "";
        sb.append(' ').append(cell.replace("|", "\\|").replace('\n', ' ')).append(" |");
      }
      sb.append('\n');
      if (r == 0) {
        sb.append('|').append("---|".repeat(columns)).append('\n');
      }
    }
    return sb.toString().strip();
  }
}
