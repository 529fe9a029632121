package com.flamingo.ai.knowledgebase.service.rag.parsing;

import com.flamingo.ai.knowledgebase.exception.ParsingException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.util.Version;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Last-resort PDF backend: plain text per page with PDFBox, split into paragraph blocks.
 *
 * <p>Layout-unaware (no titles, tables or images), but keeps a PDF searchable when both MinerU
 * backends are unavailable.
 */
@Service
@Order(30)
@Slf4j
public class PdfBoxTextParser implements DocumentParser {

  static final String ENGINE = "pdfbox";

  /** Library version from the PDFBox jar, or its major version when the jar carries none. */
  static final String ENGINE_VERSION =
      Version.getVersion() != null ? Version.getVersion() : "3";

  @Override
  public String engine() {
    return ENGINE;
  }

  @Override
  public boolean supports(ParsingContext context) {
    return context.isPdf();
  }

  @Override
  public ParseResult tryParse(ParsingContext context) {
    try (PDDocument pdf = Loader.loadPDF(context.bytes())) {
      PDFTextStripper stripper = new PDFTextStripper();
      stripper.setSortByPosition(true);
      stripper.setLineSeparator("\n");
      stripper.setParagraphEnd("\n\n");

      List<Block> blocks = new ArrayList<>();
      List<String> parts = new ArrayList<>();
      int pageCount = pdf.getNumberOfPages();
      for (int page = 1; page <= pageCount; page++) {
        stripper.setStartPage(page);
        stripper.setEndPage(page);
        String text = stripper.getText(pdf);
        for (String paragraph : text.split("\n\\s*\n")) {
          String p = paragraph.strip();
          if (!p.isEmpty()) {
            blocks.add(Block.text(BlockType.TEXT, p, page - 1));
            parts.add(p);
          }
        }
      }
      log.debug("Extracted {} paragraphs from {} pages", blocks.size(), pageCount);
      return new ParseResult(String.join("\n\n", parts), blocks, ENGINE, ENGINE_VERSION);
    } catch (IOException e) {
      throw new ParsingException(ENGINE, "Failed to read PDF: " + e.getMessage(), e);
    }
  }
}
