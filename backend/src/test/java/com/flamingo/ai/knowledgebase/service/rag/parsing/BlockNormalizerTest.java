package com.flamingo.ai.knowledgebase.service.rag.parsing;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BlockNormalizer Tests")
class BlockNormalizerTest {

  private final BlockNormalizer normalizer = new BlockNormalizer(new ObjectMapper());

  @Nested
  @DisplayName("normalize")
  class Normalize {

    @Test
    @DisplayName("Should accept alternative field names and list pages")
    void shouldAcceptAlternativeFieldNames() {
      Block block =
          normalizer.normalize(
              Map.of("content_type", "heading", "content", " Overview ", "page_no", List.of(2, 3)));

      assertThat(block.getType()).isEqualTo(BlockType.TITLE);
      assertThat(block.getText()).isEqualTo("Overview");
      assertThat(block.getPageNumbers()).containsExactly(2, 3);
    }

    @Test
    @DisplayName("Should map legacy numeric categories")
    void shouldMapNumericCategories() {
      assertThat(normalizer.normalize(Map.of("type", 1, "text", "x")).getType())
          .isEqualTo(BlockType.TITLE);
      assertThat(normalizer.normalize(Map.of("type", 99, "text", "x")).getType())
          .isEqualTo(BlockType.TEXT);
    }

    @Test
    @DisplayName("Should fold table caption and footnote around the body")
    void shouldFoldTableCaptions() {
      Block block =
          normalizer.normalize(
              Map.of(
                  "type", "table",
                  "table_body", "<table><tr><td>1</td></tr></table>",
                  "table_caption", List.of("Table 2"),
                  "table_footnote", List.of("Source: survey"),
                  "page_idx", 4));

      assertThat(block.getTableBody()).isEqualTo("<table><tr><td>1</td></tr></table>");
      assertThat(block.getText()).isEqualTo("Table 2\n\nSource: survey");
      assertThat(block.displayText()).isEqualTo("<table><tr><td>1</td></tr></table>");
      assertThat(block.getPageNumbers()).containsExactly(4);
    }

    @Test
    @DisplayName("Should read image captions, path and inline bytes")
    void shouldReadImageFields() {
      String encoded =
          "data:image/png;base64,"
              + Base64.getEncoder().encodeToString("png".getBytes(StandardCharsets.UTF_8));

      Block block =
          normalizer.normalize(
              Map.of(
                  "type", "image",
                  "img_path", "images\\fig1.png",
                  "image_caption", List.of("Figure 1"),
                  "b64_image", encoded));

      assertThat(block.getText()).isEqualTo("Figure 1");
      assertThat(block.getImagePath()).isEqualTo("images/fig1.png");
      assertThat(block.getImageBytes()).isEqualTo("png".getBytes(StandardCharsets.UTF_8));
    }
  }

  @Nested
  @DisplayName("extractBlocks")
  class ExtractBlocks {

    @Test
    @DisplayName("Should parse a content list given as a JSON string")
    void shouldParseJsonStringContentList() {
      Map<String, Object> result =
          Map.of(
              "content_list",
              "[{\"type\":\"text\",\"text\":\"Hello\",\"page_idx\":0},"
                  + "{\"type\":\"text\",\"text\":\"   \"}]");

      List<Block> blocks = normalizer.extractBlocks(result);

      assertThat(blocks).singleElement().extracting(Block::getText).isEqualTo("Hello");
    }

    @Test
    @DisplayName("Should fall back to the per-page layout and inherit the page index")
    void shouldFallBackToPdfInfo() {
      Map<String, Object> result =
          Map.of(
              "pdf_info",
              List.of(
                  Map.of(
                      "page_idx",
                      5,
                      "preproc_blocks",
                      List.of(Map.of("type", "text", "text", "On page five")))));

      List<Block> blocks = normalizer.extractBlocks(result);

      assertThat(blocks).singleElement()
          .satisfies(b -> assertThat(b.getPageNumbers()).containsExactly(5));
    }

    @Test
    @DisplayName("Should return no blocks when neither source is present")
    void shouldReturnNothingWithoutSources() {
      assertThat(normalizer.extractBlocks(Map.of("md_content", "# Title"))).isEmpty();
    }
  }

  @Test
  @DisplayName("Should reject invalid base64")
  void shouldRejectInvalidBase64() {
    assertThat(BlockNormalizer.decodeBase64("!!!!")).isNull();
    assertThat(BlockNormalizer.decodeBase64("data:image/png;base64")).isNull();
  }
}
