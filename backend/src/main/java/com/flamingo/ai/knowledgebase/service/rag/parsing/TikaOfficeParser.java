package com.flamingo.ai.knowledgebase.service.rag.parsing;

import com.flamingo.ai.knowledgebase.exception.ParsingException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.xml.parsers.DocumentBuilderFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.tika.Tika;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.ToXMLContentHandler;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Office backend (DOCX, DOC, PPTX, XLSX, XLS).
 *
 * <p>Uses Apache Tika's {@link AutoDetectParser} with a {@link ToXMLContentHandler} to produce an
 * XHTML representation, then walks the DOM:
 *
 * <ul>
 *   <li>{@code <h1>}–{@code <h6>} elements → title blocks ({@code Sheet: name} in spreadsheets)
 *   <li>{@code <table>} elements → table blocks holding a Markdown pipe table
 *   <li>{@code <p>}, {@code <li>} → text blocks
 *   <li>{@code <div class="page">} and {@code <div class="slide-content">} → page boundaries
 * </ul>
 */
@Service
@Order(40)
@Slf4j
public class TikaOfficeParser implements DocumentParser {

  static final String ENGINE = "tika";

  /** "Apache Tika 3.0.0" reduced to "3.0.0"; "3" when the jar carries no version. */
  static final String ENGINE_VERSION = versionOf(Tika.getString());

  @Override
  public String engine() {
    return ENGINE;
  }

  @Override
  public boolean supports(ParsingContext context) {
    String ext = context.extension();
    return SupportedFileTypes.OFFICE.contains(ext) || SupportedFileTypes.SPREADSHEET.contains(ext);
  }

  @Override
  public ParseResult tryParse(ParsingContext context) {
    try {
      byte[] xhtml = toXhtml(context);
      boolean spreadsheet = SupportedFileTypes.SPREADSHEET.contains(context.extension());
      List<Block> blocks = parseXhtml(xhtml, spreadsheet);
      return new ParseResult(toMarkdown(blocks), blocks, ENGINE, ENGINE_VERSION);
    } catch (ParsingException e) {
      throw e;
    } catch (Exception e) {
      throw new ParsingException(
          ENGINE, "Failed to parse " + context.extension() + ": " + e.getMessage(), e);
    }
  }

  private byte[] toXhtml(ParsingContext context) throws Exception {
    AutoDetectParser tikaParser = new AutoDetectParser();
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    ToXMLContentHandler handler = new ToXMLContentHandler(out, StandardCharsets.UTF_8.name());
    Metadata metadata = new Metadata();
    metadata.set(Metadata.CONTENT_TYPE, context.mimeType());
    tikaParser.parse(
        new ByteArrayInputStream(context.bytes()), handler, metadata, new ParseContext());
    return out.toByteArray();
  }

  List<Block> parseXhtml(byte[] xhtml, boolean spreadsheet) throws Exception {
    DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
    dbf.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
    dbf.setNamespaceAware(true);
    org.w3c.dom.Document dom = dbf.newDocumentBuilder().parse(new ByteArrayInputStream(xhtml));
    dom.getDocumentElement().normalize();

    List<Block> blocks = new ArrayList<>();
    int[] page = {-1};
    walk(dom.getDocumentElement(), blocks, page, spreadsheet);
    return blocks;
  }

  private void walk(Element root, List<Block> blocks, int[] page, boolean spreadsheet) {
    NodeList children = root.getChildNodes();
    for (int i = 0; i < children.getLength(); i++) {
      Node child = children.item(i);
      if (child.getNodeType() != Node.ELEMENT_NODE) {
        continue;
      }
      Element el = (Element) child;
      String tag = el.getLocalName() != null ? el.getLocalName() : el.getTagName();
      tag = tag.toLowerCase();
      int currentPage = Math.max(page[0], 0);

      if (tag.matches("h[1-6]")) {
        String heading = el.getTextContent().strip();
        if (!heading.isEmpty()) {
          String title = spreadsheet ? "Sheet: " + heading : heading;
          blocks.add(Block.text(BlockType.TITLE, title, currentPage));
        }
      } else if ("table".equals(tag)) {
        String markdown = tableToMarkdown(el);
        if (!markdown.isBlank()) {
          blocks.add(Block.text(BlockType.TABLE, markdown.strip(), currentPage));
        }
      } else if ("p".equals(tag) || "li".equals(tag)) {
        String text = el.getTextContent().strip();
        if (!text.isEmpty()) {
          BlockType type = "li".equals(tag) ? BlockType.LIST : BlockType.TEXT;
          blocks.add(Block.text(type, text, currentPage));
        }
      } else {
        if ("div".equals(tag) && isPageDiv(el)) {
          page[0]++;
        }
        walk(el, blocks, page, spreadsheet);
      }
    }
  }

  private static boolean isPageDiv(Element el) {
    String cls = el.getAttribute("class");
    return "page".equals(cls) || "slide-content".equals(cls);
  }

  static String tableToMarkdown(Element tableEl) {
    StringBuilder sb = new StringBuilder();
    NodeList rows = tableEl.getElementsByTagNameNS("*", "tr");
    boolean headerDone = false;

    for (int r = 0; r < rows.getLength(); r++) {
      Element row = (Element) rows.item(r);
      NodeList cells = row.getChildNodes();
      StringBuilder rowSb = new StringBuilder("|");
      int cellCount = 0;

      for (int c = 0; c < cells.getLength(); c++) {
        Node cell = cells.item(c);
        if (cell.getNodeType() != Node.ELEMENT_NODE) {
          continue;
        }
        String cellTag = ((Element) cell).getLocalName();
        if (cellTag == null) {
          cellTag = ((Element) cell).getTagName();
        }
        if ("td".equalsIgnoreCase(cellTag) || "th".equalsIgnoreCase(cellTag)) {
          String value = cell.getTextContent().strip().replace("|", "\\|").replace('\n', ' ');
          rowSb.append(" ").append(value).append(" |");
          cellCount++;
        }
      }

      if (cellCount == 0) {
        continue;
      }
      sb.append(rowSb).append("\n");
      if (!headerDone) {
        sb.append("|").append("---|".repeat(cellCount)).append("\n");
        headerDone = true;
      }
    }
    return sb.toString();
  }

  private static String toMarkdown(List<Block> blocks) {
    List<String> parts = new ArrayList<>();
    for (Block block : blocks) {
      parts.add(block.getType() == BlockType.TITLE ? "## " + block.getText() : block.getText());
    }
    return String.join("\n\n", parts);
  }

  static String versionOf(String banner) {
    String version = banner == null ? "" : banner.replace("Apache Tika", "").strip();
    return version.isEmpty() ? "3" : version;
  }
}
