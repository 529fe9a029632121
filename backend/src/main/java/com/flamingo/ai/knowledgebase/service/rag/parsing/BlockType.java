package com.flamingo.ai.knowledgebase.service.rag.parsing;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Closed set of block types. Every parser backend maps its own type names into this enum through
 * {@link #fromRaw(Object)}; unknown names become {@link #TEXT}.
 */
public enum BlockType {
  TITLE(BlockFamily.TEXT, "title", "heading"),
  TEXT(BlockFamily.TEXT, "text", "paragraph"),
  LIST(BlockFamily.TEXT, "list"),
  REF_TEXT(BlockFamily.TEXT, "ref_text"),
  PAGE_FOOTNOTE(BlockFamily.TEXT, "page_footnote"),
  ASIDE_TEXT(BlockFamily.TEXT, "aside_text"),
  EQUATION(BlockFamily.TEXT, "equation", "interline_equation"),
  TABLE(BlockFamily.TABLE, "table"),
  TABLE_CAPTION(BlockFamily.TABLE, "table_caption"),
  TABLE_FOOTNOTE(BlockFamily.TABLE, "table_footnote"),
  IMAGE(BlockFamily.IMAGE, "image", "figure", "img", "picture", "image_body"),
  IMAGE_CAPTION(BlockFamily.IMAGE, "image_caption", "figure_caption", "caption"),
  IMAGE_FOOTNOTE(BlockFamily.IMAGE, "image_footnote"),
  CODE(BlockFamily.CODE, "code"),
  CODE_CAPTION(BlockFamily.CODE, "code_caption"),
  ALGORITHM(BlockFamily.CODE, "algorithm"),
  HEADER(BlockFamily.NOISE, "header"),
  FOOTER(BlockFamily.NOISE, "footer"),
  PAGE_NUMBER(BlockFamily.NOISE, "page_number"),
  PHONETIC(BlockFamily.NOISE, "phonetic");

  private static final Map<String, BlockType> BY_NAME = new HashMap<>();

  // Numeric layout categories used by older MinerU releases.
  private static final BlockType[] BY_CODE = {TEXT, TITLE, TEXT, TABLE, IMAGE, IMAGE_CAPTION};

  static {
    for (BlockType type : values()) {
      for (String alias : type.aliases) {
        BY_NAME.put(alias, type);
      }
    }
  }

  private final BlockFamily family;
  private final String[] aliases;

  BlockType(BlockFamily family, String... aliases) {
    this.family = family;
    this.aliases = aliases;
  }

  public BlockFamily family() {
    return family;
  }

  /** Canonical lower-case name, as written by MinerU. */
  public String wireName() {
    return aliases[0];
  }

  /**
   * Maps a backend type value (string alias or legacy integer category) to a block type.
   *
   * @param raw type value from a parser response, may be null
   * @return the matching type, {@link #TEXT} when unknown
   */
  public static BlockType fromRaw(Object raw) {
    if (raw == null) {
      return TEXT;
    }
    if (raw instanceof Number number) {
      int code = number.intValue();
      return code >= 0 && code < BY_CODE.length ? BY_CODE[code] : TEXT;
    }
    String name = raw.toString().trim().toLowerCase(Locale.ROOT);
    return BY_NAME.getOrDefault(name, TEXT);
  }
}
