package com.flamingo.ai.knowledgebase.service.rag.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TikaOfficeParser Tests")
class TikaOfficeParserTest {

  private final TikaOfficeParser parser = new TikaOfficeParser();

  private static byte[] fixture(String name) throws IOException {
    try (InputStream in = TikaOfficeParserTest.class.getResourceAsStream("/fixtures/" + name)) {
      assertThat(in).as("fixture %s", name).isNotNull();
      return in.readAllBytes();
    }
  }

  /** A minimal Word package: one paragraph followed by a two-row table. */
  private static byte[] docx() throws IOException {
    String contentTypes =
        "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
            + "<Types xmlns=\"http://schemas.openxmlformats.org/package/2006/content-types\">"
            + "<Default Extension=\"rels\""
            + " ContentType=\"application/vnd.openxmlformats-package.relationships+xml\"/>"
            + "<Default Extension=\"xml\" ContentType=\"application/xml\"/>"
            + "<Override PartName=\"/word/document.xml\" ContentType=\"application/"
            + "vnd.openxmlformats-officedocument.wordprocessingml.document.main+xml\"/>"
            + "</Types>";
    String rels =
        "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
            + "<Relationships"
            + " xmlns=\"http://schemas.openxmlformats.org/package/2006/relationships\">"
            + "<Relationship Id=\"rId1\" Type=\"http://schemas.openxmlformats.org/"
            + "officeDocument/2006/relationships/officeDocument\" Target=\"word/document.xml\"/>"
            + "</Relationships>";
    String document =
        "<?xml version=\"1.0\" encoding=\"UTF-8\" standalone=\"yes\"?>"
            + "<w:document"
            + " xmlns:w=\"http://schemas.openxmlformats.org/wordprocessingml/2006/main\">"
            + "<w:body>"
            + paragraph("Revenue grew in every region.")
            + "<w:tbl>"
            + row("Region", "Revenue")
            + row("EMEA", "42")
            + "</w:tbl>"
            + "<w:sectPr/></w:body></w:document>";

    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(out)) {
      put(zip, "[Content_Types].xml", contentTypes);
      put(zip, "_rels/.rels", rels);
      put(zip, "word/document.xml", document);
    }
    return out.toByteArray();
  }

  private static String paragraph(String text) {
    return "<w:p><w:r><w:t>" + text + "</w:t></w:r></w:p>";
  }

  private static String row(String... cells) {
    StringBuilder sb = new StringBuilder("<w:tr>");
    for (String cell : cells) {
      sb.append("<w:tc>").append(paragraph(cell)).append("</w:tc>");
    }
    return sb.append("</w:tr>").toString();
  }

  private static void put(ZipOutputStream zip, String name, String content) throws IOException {
    zip.putNextEntry(new ZipEntry(name));
    zip.write(content.getBytes(StandardCharsets.UTF_8));
    zip.closeEntry();
  }

  private static ParsingContext context(String fileName, byte[] bytes) {
    return new ParsingContext(UUID.randomUUID(), fileName, "rag/col-1/doc/" + fileName, bytes);
  }

  @Test
  @DisplayName("Should take office documents and spreadsheets only")
  void shouldSupportOfficeTypes() {
    assertThat(parser.supports(context("a.docx", new byte[0]))).isTrue();
    assertThat(parser.supports(context("a.pptx", new byte[0]))).isTrue();
    assertThat(parser.supports(context("a.xlsx", new byte[0]))).isTrue();
    assertThat(parser.supports(context("a.pdf", new byte[0]))).isFalse();
    assertThat(parser.supports(context("a.md", new byte[0]))).isFalse();
  }

  @Test
  @DisplayName("Should walk slide XHTML into titles, paragraphs, list items and tables")
  void shouldWalkSlideXhtml() throws Exception {
    // When
    List<Block> blocks = parser.parseXhtml(fixture("slides.xhtml"), false);

    // Then
    assertThat(blocks)
        .extracting(Block::getType)
        .containsExactly(
            BlockType.TITLE,
            BlockType.TEXT,
            BlockType.LIST,
            BlockType.LIST,
            BlockType.TEXT,
            BlockType.TABLE);
    assertThat(blocks.get(0).getText()).isEqualTo("Quarterly review");
    assertThat(blocks.get(0).getPageNumbers()).containsExactly(0);
    assertThat(blocks.get(4).getPageNumbers()).containsExactly(1);
    assertThat(blocks.get(5).getText())
        .isEqualTo("| Region | Revenue |\n|---|---|\n| EMEA | 42 \\| est. |");
    assertThat(blocks.get(5).getPageNumbers()).containsExactly(1);
  }

  @Test
  @DisplayName("Should prefix spreadsheet headings with the sheet label")
  void shouldLabelSheets() throws Exception {
    // Given
    String xhtml =
        "<html xmlns=\"http://www.w3.org/1999/xhtml\"><body>"
            + "<div class=\"page\"><h1>Budget</h1>"
            + "<table><tr><td>Item</td><td>Cost</td></tr></table></div>"
            + "</body></html>";

    // When
    List<Block> blocks = parser.parseXhtml(xhtml.getBytes(StandardCharsets.UTF_8), true);

    // Then
    assertThat(blocks.get(0).getText()).isEqualTo("Sheet: Budget");
    assertThat(blocks.get(1).getType()).isEqualTo(BlockType.TABLE);
  }

  @Test
  @DisplayName("Should parse a Word document into text and table blocks")
  void shouldParseWordDocument() throws IOException {
    // When
    ParseResult result = parser.tryParse(context("report.docx", docx()));

    // Then
    assertThat(result.engine()).isEqualTo("tika");
    assertThat(result.engineVersion()).isNotBlank();
    assertThat(result.blocks())
        .extracting(Block::getText)
        .contains("Revenue grew in every region.");
    assertThat(result.blocks())
        .filteredOn(block -> block.getType() == BlockType.TABLE)
        .singleElement()
        .extracting(Block::getText)
        .isEqualTo("| Region | Revenue |\n|---|---|\n| EMEA | 42 |");
    assertThat(result.markdown()).contains("Revenue grew in every region.");
  }

  @Test
  @DisplayName("Should reduce the library banner to its version")
  void shouldReduceBannerToVersion() {
    assertThat(TikaOfficeParser.versionOf("Apache Tika 3.0.0")).isEqualTo("3.0.0");
    assertThat(TikaOfficeParser.versionOf("Apache Tika")).isEqualTo("3");
    assertThat(TikaOfficeParser.versionOf(null)).isEqualTo("3");
  }
}
