package com.flamingo.ai.knowledgebase.service.rag.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Coerces raw parser output into {@link Block}s.
 *
 * <p>Backends disagree on field names (type, content_type, block_type; text, content, md; page_idx,
 * page_no), on page encoding (int or list) and on how images are carried (inline base64 or an
 * archive-relative path). All of that is resolved here and nowhere else.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class BlockNormalizer {

  /** Keys under which backends report an image's archive-relative path. */
  public static final List<String> IMAGE_PATH_KEYS =
      List.of("img_path", "image_path", "path", "image_save_path", "save_path", "image_src");

  private static final List<String> TYPE_KEYS = List.of("type", "content_type", "block_type");
  private static final List<String> TEXT_KEYS = List.of("text", "content", "md");
  private static final List<String> PAGE_KEYS = List.of("page_idx", "page_no", "page");
  private static final List<String> INLINE_IMAGE_KEYS =
      List.of("image_bytes", "b64_image", "base64_image");
  private static final List<String> LIST_WRAPPER_KEYS = List.of("content_list", "items");
  private static final List<String> PDF_INFO_BLOCK_KEYS =
      List.of("preproc_blocks", "blocks", "layout_dets");

  private final ObjectMapper objectMapper;

  /**
   * Extracts blocks from a backend result object.
   *
   * <p>Looks at {@code content_list} first (a list, a JSON string, or a wrapper object), then at
   * the per-page {@code pdf_info} layout. Returns an empty list when neither is present, which lets
   * the chunker fall back to the markdown.
   *
   * @param result backend result object
   * @return normalized non-empty blocks in reading order
   */
  public List<Block> extractBlocks(Map<String, Object> result) {
    Object contentList = result.get("content_list");
    List<?> rawBlocks = asBlockList(contentList);
    if (!rawBlocks.isEmpty()) {
      return normalizeAll(rawBlocks);
    }

    if (result.get("pdf_info") instanceof List<?> pages && !pages.isEmpty()) {
      List<Block> blocks = new ArrayList<>();
      for (Object page : pages) {
        if (!(page instanceof Map<?, ?> pageMap)) {
          continue;
        }
        List<Integer> pageNumbers = pageNumbers(pageMap);
        for (String key : PDF_INFO_BLOCK_KEYS) {
          if (!(pageMap.get(key) instanceof List<?> layout) || layout.isEmpty()) {
            continue;
          }
          for (Object raw : layout) {
            if (raw instanceof Map<?, ?> rawMap) {
              Block block = normalize(rawMap);
              if (block.getPageNumbers().isEmpty()) {
                block.setPageNumbers(new ArrayList<>(pageNumbers));
              }
              if (!block.displayText().isEmpty()) {
                blocks.add(block);
              }
            }
          }
          break;
        }
      }
      return blocks;
    }
    return List.of();
  }

  /** Normalizes a raw block list, dropping entries that are not objects or carry nothing. */
  public List<Block> normalizeAll(Collection<?> rawBlocks) {
    List<Block> blocks = new ArrayList<>(rawBlocks.size());
    for (Object raw : rawBlocks) {
      if (!(raw instanceof Map<?, ?> rawMap)) {
        continue;
      }
      Block block = normalize(rawMap);
      if (!block.isEmpty() || block.getImagePath() != null) {
        blocks.add(block);
      }
    }
    return blocks;
  }

  /**
   * Normalizes one raw block.
   *
   * @param raw block object as decoded from JSON
   * @return the normalized block, possibly empty
   */
  public Block normalize(Map<?, ?> raw) {
    BlockType type = BlockType.fromRaw(firstPresent(raw, TYPE_KEYS));
    String text = firstString(raw, TEXT_KEYS);

    Block.BlockBuilder builder =
        Block.builder().type(type).pageNumbers(pageNumbers(raw)).imagePath(imagePath(raw));

    if (type.family() == BlockFamily.TABLE) {
      String body = firstString(raw, List.of("table_body", "html"));
      builder.tableBody(body.isEmpty() ? null : body);
      String caption = joinStrings(raw.get("table_caption"));
      String footnote = joinStrings(raw.get("table_footnote"));
      text = joinNonBlank(caption, text, footnote);
    } else if (type.family() == BlockFamily.IMAGE && text.isEmpty()) {
      text =
          joinNonBlank(joinStrings(raw.get("image_caption")), joinStrings(raw.get("img_caption")));
    } else if (type.family() == BlockFamily.CODE) {
      String body = firstString(raw, List.of("code_body"));
      text = joinNonBlank(joinStrings(raw.get("code_caption")), text.isEmpty() ? body : text);
    }
    builder.text(text);

    byte[] inline = inlineImage(raw);
    if (inline != null) {
      builder.imageBytes(inline);
    }
    return builder.build();
  }

  /**
   * Decodes base64 image data, accepting a {@code data:} URI prefix.
   *
   * @return decoded bytes, or null when the value is not valid base64
   */
  public static byte[] decodeBase64(String value) {
    if (value == null || value.isBlank()) {
      return null;
    }
    String data = value.strip();
    if (data.startsWith("data:")) {
      int comma = data.indexOf(',');
      if (comma < 0) {
        return null;
      }
      data = data.substring(comma + 1);
    }
    try {
      byte[] decoded = Base64.getMimeDecoder().decode(data);
      return decoded.length == 0 ? null : decoded;
    } catch (IllegalArgumentException e) {
      log.debug("Ignoring invalid base64 image payload: {}", e.getMessage());
      return null;
    }
  }

  /** Returns the first non-blank image path value of a raw block, or null. */
  public static String imagePath(Map<?, ?> raw) {
    for (String key : IMAGE_PATH_KEYS) {
      if (raw.get(key) instanceof String value && !value.isBlank()) {
        return value.strip().replace('\\', '/');
      }
    }
    return null;
  }

  private List<?> asBlockList(Object contentList) {
    if (contentList instanceof List<?> list) {
      return list;
    }
    if (contentList instanceof String json && !json.isBlank()) {
      try {
        Object parsed = objectMapper.readValue(json, Object.class);
        return asBlockList(parsed instanceof List<?> ? parsed : unwrap(parsed));
      } catch (JsonProcessingException e) {
        log.warn("content_list is not valid JSON: {}", e.getOriginalMessage());
        return List.of();
      }
    }
    if (contentList instanceof Map<?, ?>) {
      return asBlockList(unwrap(contentList));
    }
    return List.of();
  }

  private static Object unwrap(Object value) {
    if (value instanceof Map<?, ?> map) {
      for (String key : LIST_WRAPPER_KEYS) {
        if (map.get(key) instanceof List<?> list) {
          return list;
        }
      }
    }
    return List.of();
  }

  private List<Integer> pageNumbers(Map<?, ?> raw) {
    Object value = firstPresent(raw, PAGE_KEYS);
    List<Integer> pages = new ArrayList<>();
    if (value instanceof Number number) {
      pages.add(number.intValue());
    } else if (value instanceof Collection<?> values) {
      for (Object v : values) {
        Integer page = toInt(v);
        if (page != null) {
          pages.add(page);
        }
      }
    } else if (value instanceof String s) {
      Integer page = toInt(s);
      if (page != null) {
        pages.add(page);
      }
    }
    return pages;
  }

  private static Integer toInt(Object value) {
    if (value instanceof Number number) {
      return number.intValue();
    }
    if (value instanceof String s) {
      try {
        return Integer.parseInt(s.strip());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private byte[] inlineImage(Map<?, ?> raw) {
    for (String key : INLINE_IMAGE_KEYS) {
      Object value = raw.get(key);
      if (value instanceof byte[] bytes && bytes.length > 0) {
        return bytes;
      }
      if (value instanceof String encoded) {
        byte[] decoded = decodeBase64(encoded);
        if (decoded != null) {
          return decoded;
        }
      }
    }
    return null;
  }

  private static Object firstPresent(Map<?, ?> raw, List<String> keys) {
    for (String key : keys) {
      Object value = raw.get(key);
      if (value != null && !(value instanceof String s && s.isBlank())) {
        return value;
      }
    }
    return null;
  }

  private static String firstString(Map<?, ?> raw, List<String> keys) {
    for (String key : keys) {
      if (raw.get(key) instanceof String value && !value.isBlank()) {
        return value.strip();
      }
    }
    return "";
  }

  private static String joinStrings(Object value) {
    if (value instanceof String s) {
      return s.strip();
    }
    if (value instanceof Collection<?> values) {
      List<String> parts = new ArrayList<>();
      for (Object v : values) {
        if (v != null && !v.toString().isBlank()) {
          parts.add(v.toString().strip());
        }
      }
      return String.join("\n", parts);
    }
    return "";
  }

  private static String joinNonBlank(String... parts) {
    List<String> kept = new ArrayList<>();
    for (String part : parts) {
      if (part != null && !part.isBlank()) {
        kept.add(part);
      }
    }
    return String.join("\n\n", kept);
  }
}
