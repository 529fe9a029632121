package com.flamingo.ai.knowledgebase.service.rag.parsing;

import java.util.ArrayList;
import java.util.List;
import org.commonmark.Extension;
import org.commonmark.ext.gfm.tables.TableBlock;
import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.node.BulletList;
import org.commonmark.node.Code;
import org.commonmark.node.FencedCodeBlock;
import org.commonmark.node.Heading;
import org.commonmark.node.Image;
import org.commonmark.node.IndentedCodeBlock;
import org.commonmark.node.Node;
import org.commonmark.node.OrderedList;
import org.commonmark.node.Paragraph;
import org.commonmark.node.SourceSpan;
import org.commonmark.node.Text;
import org.commonmark.node.ThematicBreak;
import org.commonmark.parser.IncludeSourceSpans;
import org.commonmark.parser.Parser;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Markdown files. Top-level nodes map to blocks; block text is the original source slice so
 * tables and links survive unchanged.
 */
@Service
@Order(55)
public class MarkdownParser implements DocumentParser {

  static final String ENGINE = "markdown";

  private static final List<Extension> EXTENSIONS = List.of(TablesExtension.create());

  private final Parser parser =
      Parser.builder()
          .extensions(EXTENSIONS)
          .includeSourceSpans(IncludeSourceSpans.BLOCKS)
          .build();

  @Override
  public String engine() {
    return ENGINE;
  }

  @Override
  public boolean supports(ParsingContext context) {
    return SupportedFileTypes.MARKDOWN.contains(context.extension());
  }

  @Override
  public ParseResult tryParse(ParsingContext context) {
    String markdown = TextDecoding.decode(context.bytes());
    return new ParseResult(markdown, toBlocks(markdown), ENGINE, "commonmark");
  }

  List<Block> toBlocks(String markdown) {
    String[] lines = markdown.split("\\r?\\n", -1);
    Node document = parser.parse(markdown);
    List<Block> blocks = new ArrayList<>();
    for (Node node = document.getFirstChild(); node != null; node = node.getNext()) {
      if (node instanceof ThematicBreak) {
        continue;
      }
      String source = sourceOf(node, lines);
      if (source.isBlank()) {
        continue;
      }
      BlockType type = typeOf(node);
      String text = node instanceof Heading ? literalText(node).strip() : source;
      blocks.add(Block.text(type, text, 0));
    }
    return blocks;
  }

  private static BlockType typeOf(Node node) {
    if (node instanceof Heading) {
      return BlockType.TITLE;
    }
    if (node instanceof TableBlock) {
      return BlockType.TABLE;
    }
    if (node instanceof FencedCodeBlock || node instanceof IndentedCodeBlock) {
      return BlockType.CODE;
    }
    if (node instanceof BulletList || node instanceof OrderedList) {
      return BlockType.LIST;
    }
    if (node instanceof Paragraph && containsImage(node)) {
      return BlockType.IMAGE_CAPTION;
    }
    return BlockType.TEXT;
  }

  private static boolean containsImage(Node node) {
    for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
      if (child instanceof Image || containsImage(child)) {
        return true;
      }
    }
    return false;
  }

  private static String literalText(Node node) {
    StringBuilder sb = new StringBuilder();
    for (Node child = node.getFirstChild(); child != null; child = child.getNext()) {
      if (child instanceof Text text) {
        sb.append(text.getLiteral());
      } else if (child instanceof Code code) {
        sb.append(code.getLiteral());
      } else {
        sb.append(literalText(child));
      }
    }
    return sb.toString();
  }

  private static String sourceOf(Node node, String[] lines) {
    List<SourceSpan> spans = node.getSourceSpans();
    if (spans.isEmpty()) {
      return "";
    }
    int first = spans.get(0).getLineIndex();
    int last = spans.get(spans.size() - 1).getLineIndex();
    StringBuilder sb = new StringBuilder();
    for (int i = first; i <= last && i < lines.length; i++) {
      if (sb.length() > 0) {
        sb.append('\n');
      }
      sb.append(lines[i]);
    }
    return sb.toString().strip();
  }
}
