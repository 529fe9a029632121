package com.flamingo.ai.knowledgebase.service.rag.chunking;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import com.flamingo.ai.knowledgebase.domain.enums.ChunkType;
import com.flamingo.ai.knowledgebase.service.rag.parsing.Block;
import com.flamingo.ai.knowledgebase.service.rag.parsing.BlockFamily;
import com.flamingo.ai.knowledgebase.service.rag.parsing.BlockType;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns normalized blocks into a two-level parent/child chunk set.
 *
 * <p>Headings (real or pseudo) open a new parent. Tables, images and code are buffered per family
 * and emitted as one atomic child when the family changes. A parent that is already large is also
 * closed on a page break or a change of block type, and always before it would exceed the parent
 * budget. Each parent is followed by its children; children without parent text stand alone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LayoutAwareChunker {

  static final String IMAGE_PLACEHOLDER = "[image]";

  private final RagConfig ragConfig;

  /**
   * Chunks parsed blocks, or the markdown when no block survived parsing.
   *
   * @param blocks normalized blocks in reading order
   * @param markdownFallback markdown rendering used when {@code blocks} is empty
   * @return parents and children in chunk-index order
   */
  public List<ChunkDraft> chunk(List<Block> blocks, String markdownFallback) {
    List<Block> input = blocks;
    if ((input == null || input.isEmpty())
        && markdownFallback != null
        && !markdownFallback.isBlank()) {
      input = MarkdownBlockSplitter.toBlocks(markdownFallback);
      log.debug("No blocks; chunking markdown as {} synthetic blocks", input.size());
    }
    if (input == null || input.isEmpty()) {
      return List.of();
    }
    List<ChunkDraft> drafts = new Run(Settings.from(ragConfig.getChunking())).process(input);
    log.debug("Chunked {} blocks into {} chunks", input.size(), drafts.size());
    return drafts;
  }

  /** Chunking limits with their lower bounds applied. */
  record Settings(
      int maxParentTokens,
      int splitMinParentTokens,
      int splitMinChildren,
      int pseudoTitleMaxChars,
      int maxChildTokens,
      boolean pseudoTitleEnabled,
      boolean pageBreakSplitEnabled,
      boolean typeShiftSplitEnabled) {

    static Settings from(RagConfig.Chunking c) {
      return new Settings(
          Math.max(256, c.getMaxParentTokens()),
          Math.max(128, c.getSplitMinParentTokens()),
          Math.max(1, c.getSplitMinChildren()),
          Math.max(16, c.getPseudoTitleMaxChars()),
          Math.max(16, c.getMaxChildTokens()),
          c.isPseudoTitleEnabled(),
          c.isPageBreakSplitEnabled(),
          c.isTypeShiftSplitEnabled());
    }
  }

  private record PendingChild(ChunkType type, String content, List<Integer> pages) {}

  /** State of one chunking pass. Not thread-safe; one instance per document. */
  private static final class Run {

    private final Settings settings;
    private final List<ChunkDraft> out = new ArrayList<>();

    private UUID parentId = UUID.randomUUID();
    private final List<String> parentContent = new ArrayList<>();
    private final Set<Integer> parentPages = new TreeSet<>();
    private int parentTokens;
    private final List<PendingChild> children = new ArrayList<>();
    private BlockType lastType;

    private final List<Block> pendingTables = new ArrayList<>();
    private final List<Block> pendingImages = new ArrayList<>();
    private final List<Block> pendingCode = new ArrayList<>();

    Run(Settings settings) {
      this.settings = settings;
    }

    List<ChunkDraft> process(List<Block> blocks) {
      for (Block block : blocks) {
        accept(block);
      }
      flushTables();
      flushImages();
      flushCode();
      flushParent();
      return out;
    }

    private void accept(Block block) {
      BlockFamily family = block.family();
      if (family == BlockFamily.NOISE) {
        return;
      }
      if (family != BlockFamily.TABLE) {
        flushTables();
      }
      if (family != BlockFamily.IMAGE) {
        flushImages();
      }
      if (family != BlockFamily.CODE) {
        flushCode();
      }
      switch (family) {
        case TABLE -> pendingTables.add(block);
        case IMAGE -> pendingImages.add(block);
        case CODE -> pendingCode.add(block);
        default -> acceptText(block);
      }
    }

    private void acceptText(Block block) {
      BlockType type = block.getType() == null ? BlockType.TEXT : block.getType();
      String text = block.displayText();
      if (type == BlockType.EQUATION && !text.isEmpty()) {
        text = "\n$$\n" + text + "\n$$\n";
      } else if (type == BlockType.ASIDE_TEXT && !text.isEmpty()) {
        text = "(Side note: " + text + ")";
      }
      text = text.strip();
      if (text.isEmpty()) {
        return;
      }
      List<Integer> pages = block.getPageNumbers();
      int tokens = TokenEstimator.estimate(text);

      boolean pseudoTitle =
          settings.pseudoTitleEnabled()
              && type == BlockType.TEXT
              && PseudoTitleDetector.isPseudoTitle(text, settings.pseudoTitleMaxChars());
      if (type == BlockType.TITLE || pseudoTitle) {
        flushParent();
        addToParent(text, pages, tokens);
        lastType = null;
        return;
      }

      if (shouldSoftSplit(type, pages)) {
        flushParent();
      }
      if (!parentContent.isEmpty()
          && (parentTokens >= settings.maxParentTokens()
              || parentTokens + tokens > settings.maxParentTokens())) {
        flushParent();
      }

      addToParent(text, pages, tokens);
      if (tokens > settings.maxChildTokens()) {
        for (String piece : RecursiveTextSplitter.split(text, settings.maxChildTokens())) {
          String p = piece.strip();
          if (!p.isEmpty()) {
            children.add(new PendingChild(ChunkType.TEXT, p, pages));
          }
        }
      } else {
        children.add(new PendingChild(ChunkType.TEXT, text, pages));
      }
      lastType = type;
    }

    private boolean shouldSoftSplit(BlockType type, List<Integer> pages) {
      if (parentContent.isEmpty()
          || parentTokens < settings.splitMinParentTokens()
          || children.size() < settings.splitMinChildren()) {
        return false;
      }
      if (settings.pageBreakSplitEnabled()
          && !pages.isEmpty()
          && !parentPages.isEmpty()
          && !parentPages.containsAll(pages)) {
        return true;
      }
      return settings.typeShiftSplitEnabled() && lastType != null && type != lastType;
    }

    private void addToParent(String content, List<Integer> pages, int tokens) {
      parentContent.add(content);
      parentPages.addAll(pages);
      parentTokens += tokens;
    }

    private void addAtomic(ChunkType type, String content, Set<Integer> pages) {
      int tokens = TokenEstimator.estimate(content);
      if (!parentContent.isEmpty() && parentTokens + tokens > settings.maxParentTokens()) {
        flushParent();
      }
      PendingChild child = new PendingChild(type, content, List.copyOf(pages));
      if (tokens > settings.maxParentTokens()) {
        // Atomic units are never split; one over the ceiling stands alone.
        flushParent();
        children.add(child);
        flushParent();
        return;
      }
      addToParent(content, child.pages(), tokens);
      children.add(child);
    }

    private void flushTables() {
      if (pendingTables.isEmpty()) {
        return;
      }
      Set<Integer> pages = new TreeSet<>();
      String combined = join(pendingTables, pages);
      pendingTables.clear();
      if (combined.isEmpty()) {
        return;
      }
      addAtomic(ChunkType.TABLE, combined, pages);
      lastType = BlockType.TABLE;
    }

    private void flushImages() {
      if (pendingImages.isEmpty()) {
        return;
      }
      List<Block> withoutUrl = new ArrayList<>();
      for (Block block : pendingImages) {
        String url = block.getImageUrl();
        if (url == null || url.isBlank()) {
          withoutUrl.add(block);
          continue;
        }
        String caption = block.displayText();
        String content = caption.isEmpty() ? url : url + "\n" + caption;
        addAtomic(ChunkType.IMAGE_CAPTION, content, new TreeSet<>(block.getPageNumbers()));
      }
      pendingImages.clear();
      if (!withoutUrl.isEmpty()) {
        Set<Integer> pages = new TreeSet<>();
        String combined = join(withoutUrl, pages);
        String content = combined.isEmpty() ? IMAGE_PLACEHOLDER : combined;
        addAtomic(ChunkType.IMAGE_CAPTION, content, pages);
      }
      lastType = BlockType.IMAGE_CAPTION;
    }

    private void flushCode() {
      if (pendingCode.isEmpty()) {
        return;
      }
      Set<Integer> pages = new TreeSet<>();
      String combined = join(pendingCode, pages);
      pendingCode.clear();
      if (combined.isEmpty()) {
        return;
      }
      addAtomic(ChunkType.CODE, "\n```\n" + combined + "\n```\n", pages);
      lastType = BlockType.CODE;
    }

    private static String join(List<Block> blocks, Set<Integer> pages) {
      List<String> parts = new ArrayList<>();
      for (Block block : blocks) {
        String text = block.displayText();
        if (!text.isEmpty()) {
          parts.add(text);
        }
        pages.addAll(block.getPageNumbers());
      }
      return String.join("\n\n", parts).strip();
    }

    private void flushParent() {
      UUID owner = null;
      if (!parentContent.isEmpty()) {
        String content = String.join("\n\n", parentContent);
        out.add(
            new ChunkDraft(
                parentId,
                null,
                out.size(),
                ChunkType.TEXT,
                content,
                TokenEstimator.estimate(content),
                List.copyOf(parentPages),
                true));
        owner = parentId;
      }
      for (PendingChild child : children) {
        out.add(
            new ChunkDraft(
                UUID.randomUUID(),
                owner,
                out.size(),
                child.type(),
                child.content(),
                TokenEstimator.estimate(child.content()),
                sorted(child.pages()),
                false));
      }
      parentId = UUID.randomUUID();
      parentContent.clear();
      parentPages.clear();
      parentTokens = 0;
      children.clear();
    }

    private static List<Integer> sorted(List<Integer> pages) {
      return List.copyOf(new TreeSet<>(pages));
    }
  }
}
