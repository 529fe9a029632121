package com.flamingo.ai.knowledgebase.service.rag.chunking;

import com.flamingo.ai.knowledgebase.service.rag.parsing.Block;
import com.flamingo.ai.knowledgebase.service.rag.parsing.BlockType;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Converts bare markdown into synthetic blocks so it can go through the layout-aware chunker. */
final class MarkdownBlockSplitter {

  private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.+)$", Pattern.MULTILINE);
  private static final Pattern IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\(([^)]+)\\)");

  private MarkdownBlockSplitter() {}

  static List<Block> toBlocks(String markdown) {
    List<Block> blocks = new ArrayList<>();
    Matcher m = HEADING.matcher(markdown);
    List<Integer> starts = new ArrayList<>();
    while (m.find()) {
      starts.add(m.start());
    }
    if (starts.isEmpty()) {
      addParagraphs(markdown, blocks);
      return blocks;
    }
    if (starts.get(0) > 0) {
      addParagraphs(markdown.substring(0, starts.get(0)), blocks);
    }
    for (int i = 0; i < starts.size(); i++) {
      int end = i + 1 < starts.size() ? starts.get(i + 1) : markdown.length();
      String section = markdown.substring(starts.get(i), end).strip();
      int newline = section.indexOf('\n');
      String title = newline < 0 ? section : section.substring(0, newline).strip();
      blocks.add(block(BlockType.TITLE, title));
      if (newline >= 0) {
        addParagraphs(section.substring(newline + 1), blocks);
      }
    }
    return blocks;
  }

  private static void addParagraphs(String text, List<Block> blocks) {
    for (String paragraph : text.split("\n\n")) {
      String p = paragraph.strip();
      if (!p.isEmpty()) {
        blocks.add(block(detectType(p), p));
      }
    }
  }

  static BlockType detectType(String paragraph) {
    long pipeLines =
        paragraph
            .lines()
            .map(String::strip)
            .filter(l -> l.length() > 1 && l.startsWith("|") && l.endsWith("|"))
            .count();
    if (pipeLines >= 2) {
      return BlockType.TABLE;
    }
    if (IMAGE.matcher(paragraph).find()) {
      return BlockType.IMAGE_CAPTION;
    }
    return BlockType.TEXT;
  }

  private static Block block(BlockType type, String text) {
    return Block.builder().type(type).text(text).build();
  }
}
