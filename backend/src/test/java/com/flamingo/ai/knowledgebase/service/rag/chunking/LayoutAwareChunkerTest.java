package com.flamingo.ai.knowledgebase.service.rag.chunking;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import com.flamingo.ai.knowledgebase.service.rag.parsing.Block;
import com.flamingo.ai.knowledgebase.service.rag.parsing.BlockType;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LayoutAwareChunker Tests")
class LayoutAwareChunkerTest {

  private RagConfig ragConfig;
  private LayoutAwareChunker chunker;

  @BeforeEach
  void setUp() {
    ragConfig = new RagConfig();
    chunker = new LayoutAwareChunker(ragConfig);
  }

  private static Block text(String text, int page) {
    return Block.text(BlockType.TEXT, text, page);
  }

  private static Block title(String text, int page) {
    return Block.text(BlockType.TITLE, text, page);
  }

  private static String words(int count) {
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < count; i++) {
      sb.append("word").append(i % 10).append(' ');
    }
    return sb.toString().trim() + ".";
  }

  private static List<ChunkDraft> parents(List<ChunkDraft> drafts) {
    return drafts.stream().filter(ChunkDraft::parent).toList();
  }

  private static List<ChunkDraft> children(List<ChunkDraft> drafts) {
    return drafts.stream().filter(d -> !d.parent()).toList();
  }

  @Nested
  @DisplayName("Headings")
  class Headings {

    @Test
    @DisplayName("Should open a new parent at every title")
    void shouldOpenNewParentAtEveryTitle() {
      // Given
      List<Block> blocks =
          List.of(
              title("Overview", 0),
              text("The system stores documents.", 0),
              title("Retrieval", 0),
              text("Search combines three recall paths.", 0));

      // When
      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      // Then
      assertThat(parents(drafts)).hasSize(2);
      assertThat(parents(drafts).get(0).content())
          .isEqualTo("Overview\n\nThe system stores documents.");
      assertThat(parents(drafts).get(1).content()).startsWith("Retrieval");
      assertThat(children(drafts))
          .extracting(ChunkDraft::content)
          .containsExactly("The system stores documents.", "Search combines three recall paths.");
    }

    @Test
    @DisplayName("Should treat numbered text lines as headings")
    void shouldTreatNumberedTextLinesAsHeadings() {
      List<Block> blocks =
          List.of(
              text("Some opening paragraph.", 0),
              text("2.1 Data Model", 0),
              text("Chunks are immutable after insert.", 0));

      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      assertThat(parents(drafts)).hasSize(2);
      assertThat(parents(drafts).get(1).content()).startsWith("2.1 Data Model");
    }

    @Test
    @DisplayName("Should not treat headings as pseudo titles when disabled")
    void shouldIgnorePseudoTitlesWhenDisabled() {
      ragConfig.getChunking().setPseudoTitleEnabled(false);
      List<Block> blocks =
          List.of(text("Some opening paragraph.", 0), text("Introduction", 0), text("Body.", 0));

      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      assertThat(parents(drafts)).hasSize(1);
      assertThat(children(drafts)).hasSize(3);
    }
  }

  @Nested
  @DisplayName("Atomic blocks")
  class AtomicBlocks {

    @Test
    @DisplayName("Should merge consecutive tables into one table child")
    void shouldMergeConsecutiveTables() {
      List<Block> blocks =
          List.of(
              text("Results are below.", 0),
              Block.text(BlockType.TABLE_CAPTION, "Table 1: Scores", 0),
              Block.text(BlockType.TABLE, "| a | b |\n|---|---|\n| 1 | 2 |", 1),
              text("As shown above.", 1));

      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      List<ChunkDraft> tables =
          drafts.stream().filter(d -> d.type() == ChunkType.TABLE).toList();
      assertThat(tables).hasSize(1);
      assertThat(tables.get(0).content())
          .isEqualTo("Table 1: Scores\n\n| a | b |\n|---|---|\n| 1 | 2 |");
      assertThat(tables.get(0).pageNumbers()).containsExactly(0, 1);
    }

    @Test
    @DisplayName("Should emit one child per uploaded image with url and caption")
    void shouldEmitOneChildPerUploadedImage() {
      Block first = Block.text(BlockType.IMAGE, "Figure 1", 0);
      first.setImageUrl("http://blob/a.png");
      Block second = Block.text(BlockType.IMAGE, "", 0);
      second.setImageUrl("http://blob/b.png");

      List<ChunkDraft> drafts = chunker.chunk(List.of(first, second), "");

      assertThat(children(drafts))
          .extracting(ChunkDraft::content)
          .containsExactly("http://blob/a.png\nFigure 1", "http://blob/b.png");
      assertThat(children(drafts)).allMatch(d -> d.type() == ChunkType.IMAGE_CAPTION);
    }

    @Test
    @DisplayName("Should merge images without url into one captioned child")
    void shouldMergeImagesWithoutUrl() {
      List<Block> blocks =
          List.of(
              Block.text(BlockType.IMAGE, "", 2),
              Block.text(BlockType.IMAGE_CAPTION, "Figure 2: Pipeline", 2));

      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      assertThat(children(drafts)).hasSize(1);
      assertThat(children(drafts).get(0).content()).isEqualTo("Figure 2: Pipeline");
    }

    @Test
    @DisplayName("Should use a placeholder for images with neither url nor caption")
    void shouldUsePlaceholderForBareImages() {
      List<ChunkDraft> drafts = chunker.chunk(List.of(Block.text(BlockType.IMAGE, "", 0)), "");

      assertThat(children(drafts)).singleElement()
          .extracting(ChunkDraft::content)
          .isEqualTo(LayoutAwareChunker.IMAGE_PLACEHOLDER);
    }

    @Test
    @DisplayName("Should fence code blocks")
    void shouldFenceCodeBlocks() {
      List<ChunkDraft> drafts =
          chunker.chunk(List.of(Block.text(BlockType.CODE, "int x = 1;", 0)), "");

      assertThat(children(drafts)).singleElement()
          .satisfies(
              d -> {
                assertThat(d.type()).isEqualTo(ChunkType.CODE);
                assertThat(d.content().strip()).isEqualTo("```\nint x = 1;\n```");
              });
    }
  }

  @Nested
  @DisplayName("Text handling")
  class TextHandling {

    @Test
    @DisplayName("Should drop page furniture")
    void shouldDropPageFurniture() {
      List<Block> blocks =
          List.of(
              Block.text(BlockType.HEADER, "ACME Confidential", 0),
              text("Body text.", 0),
              Block.text(BlockType.PAGE_NUMBER, "1", 0),
              Block.text(BlockType.FOOTER, "footer", 0));

      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      assertThat(drafts)
          .extracting(ChunkDraft::content)
          .containsExactly("Body text.", "Body text.");
    }

    @Test
    @DisplayName("Should wrap equations and mark side notes")
    void shouldWrapEquationsAndMarkSideNotes() {
      List<Block> blocks =
          List.of(
              Block.text(BlockType.EQUATION, "E = mc^2", 0),
              Block.text(BlockType.ASIDE_TEXT, "Draft only", 0));

      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      assertThat(children(drafts))
          .extracting(ChunkDraft::content)
          .containsExactly("$$\nE = mc^2\n$$", "(Side note: Draft only)");
    }

    @Test
    @DisplayName("Should split oversized text into several children under one parent")
    void shouldSplitOversizedText() {
      List<ChunkDraft> drafts = chunker.chunk(List.of(text(words(900), 0)), "");

      assertThat(parents(drafts)).hasSize(1);
      assertThat(children(drafts)).hasSizeGreaterThan(1);
      assertThat(children(drafts))
          .allMatch(d -> d.parentId().equals(parents(drafts).get(0).id()));
    }

    @Test
    @DisplayName("Should keep every parent within the parent budget")
    void shouldKeepParentsWithinBudget() {
      ragConfig.getChunking().setMaxParentTokens(300);
      ragConfig.getChunking().setPageBreakSplitEnabled(false);
      ragConfig.getChunking().setTypeShiftSplitEnabled(false);
      List<Block> blocks = IntStream.range(0, 12).mapToObj(i -> text(words(60), 0)).toList();

      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      assertThat(parents(drafts)).hasSizeGreaterThan(1);
      assertThat(parents(drafts)).allMatch(p -> p.tokenCount() <= 300);
    }

    @Test
    @DisplayName("Should keep parents within budget when tables and images alternate")
    void shouldKeepParentsWithinBudgetForAtomicBlocks() {
      // Given
      ragConfig.getChunking().setMaxParentTokens(300);
      List<Block> blocks = new ArrayList<>();
      blocks.add(text(words(60), 0));
      for (int i = 0; i < 10; i++) {
        BlockType type = i % 2 == 0 ? BlockType.TABLE : BlockType.IMAGE_CAPTION;
        blocks.add(Block.text(type, words(60), 0));
      }

      // When
      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      // Then
      assertThat(parents(drafts)).hasSizeGreaterThan(1);
      assertThat(parents(drafts)).allMatch(p -> p.tokenCount() <= 300);
      assertThat(children(drafts)).hasSize(11).allMatch(c -> c.parentId() != null);
      assertThat(children(drafts))
          .filteredOn(c -> c.type() == ChunkType.TABLE)
          .hasSize(5);
    }

    @Test
    @DisplayName("Should emit an atomic block larger than the budget as a standalone chunk")
    void shouldStandAloneOversizedAtomicBlock() {
      // Given
      ragConfig.getChunking().setMaxParentTokens(300);
      List<Block> blocks =
          List.of(
              text("Revenue by region.", 0),
              Block.text(BlockType.TABLE, words(400), 0),
              text("Totals follow.", 0));

      // When
      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      // Then
      ChunkDraft table =
          drafts.stream().filter(d -> d.type() == ChunkType.TABLE).findFirst().orElseThrow();
      assertThat(table.parentId()).isNull();
      assertThat(parents(drafts)).hasSize(2).allMatch(p -> p.tokenCount() <= 300);
      assertThat(drafts)
          .extracting(ChunkDraft::chunkIndex)
          .isEqualTo(IntStream.range(0, drafts.size()).boxed().toList());
    }

    @Test
    @DisplayName("Should close a large parent when the block type changes")
    void shouldCloseLargeParentOnTypeShift() {
      // Given
      ragConfig.getChunking().setSplitMinParentTokens(128);
      ragConfig.getChunking().setSplitMinChildren(1);
      List<Block> blocks =
          List.of(text(words(150), 0), Block.text(BlockType.EQUATION, "E = mc^2", 0));

      // When
      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      // Then
      assertThat(parents(drafts)).hasSize(2);
      assertThat(parents(drafts).get(1).content()).isEqualTo("$$\nE = mc^2\n$$");
    }

    @Test
    @DisplayName("Should keep one parent when type-shift splitting is disabled")
    void shouldIgnoreTypeShiftWhenDisabled() {
      // Given
      ragConfig.getChunking().setSplitMinParentTokens(128);
      ragConfig.getChunking().setSplitMinChildren(1);
      ragConfig.getChunking().setTypeShiftSplitEnabled(false);
      List<Block> blocks =
          List.of(text(words(150), 0), Block.text(BlockType.EQUATION, "E = mc^2", 0));

      // When
      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      // Then
      assertThat(parents(drafts)).hasSize(1);
    }

    @Test
    @DisplayName("Should close a large parent at a page break")
    void shouldCloseLargeParentAtPageBreak() {
      ragConfig.getChunking().setSplitMinParentTokens(128);
      ragConfig.getChunking().setSplitMinChildren(1);
      List<Block> blocks = List.of(text(words(150), 0), text(words(20), 1));

      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      assertThat(parents(drafts)).hasSize(2);
      assertThat(parents(drafts).get(0).pageNumbers()).containsExactly(0);
      assertThat(parents(drafts).get(1).pageNumbers()).containsExactly(1);
    }

    @Test
    @DisplayName("Should keep a small parent across a page break")
    void shouldKeepSmallParentAcrossPageBreak() {
      List<Block> blocks = List.of(text("Short one.", 0), text("Short two.", 1));

      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      assertThat(parents(drafts)).singleElement()
          .extracting(ChunkDraft::pageNumbers)
          .isEqualTo(List.of(0, 1));
    }
  }

  @Nested
  @DisplayName("Structure")
  class Structure {

    @Test
    @DisplayName("Should emit each parent before its children with dense indexes")
    void shouldEmitParentsBeforeChildren() {
      List<Block> blocks = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        blocks.add(title("Section " + (i + 1), i));
        blocks.add(text("Paragraph for section " + (i + 1) + ".", i));
        blocks.add(Block.text(BlockType.TABLE, "| x |\n|---|\n| " + i + " |", i));
      }

      List<ChunkDraft> drafts = chunker.chunk(blocks, "");

      Map<UUID, Integer> parentPositions = new HashMap<>();
      for (int i = 0; i < drafts.size(); i++) {
        ChunkDraft draft = drafts.get(i);
        assertThat(draft.chunkIndex()).isEqualTo(i);
        if (draft.parent()) {
          assertThat(draft.parentId()).isNull();
          parentPositions.put(draft.id(), i);
        } else if (draft.parentId() != null) {
          assertThat(parentPositions).containsKey(draft.parentId());
          assertThat(parentPositions.get(draft.parentId())).isLessThan(i);
        }
      }
      assertThat(drafts).filteredOn(ChunkDraft::parent).allMatch(d -> !d.isEmbeddable());
    }

    @Test
    @DisplayName("Should chunk markdown when the parser produced no blocks")
    void shouldChunkMarkdownFallback() {
      List<ChunkDraft> drafts =
          chunker.chunk(List.of(), "# Guide\n\nFirst paragraph.\n\nSecond paragraph.");

      assertThat(parents(drafts)).singleElement()
          .extracting(ChunkDraft::content)
          .asString()
          .startsWith("# Guide");
      assertThat(children(drafts)).hasSize(2);
    }

    @Test
    @DisplayName("Should return nothing for empty input")
    void shouldReturnNothingForEmptyInput() {
      assertThat(chunker.chunk(List.of(), "  ")).isEmpty();
    }
  }
}
