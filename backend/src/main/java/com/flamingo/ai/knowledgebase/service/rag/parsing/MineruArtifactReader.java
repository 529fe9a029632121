package com.flamingo.ai.knowledgebase.service.rag.parsing;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads the zip artifact produced by a MinerU extraction task.
 *
 * <p>The archive layout varies between service versions: markdown is the concatenation of all
 * {@code .md} entries; the block list is the first JSON list that looks like blocks, found under
 * one of several wrapper keys; images are separate entries referenced by path from the blocks.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MineruArtifactReader {

  private static final List<String> BLOCK_LIST_KEYS =
      List.of(
          "content_list", "items", "content_list_v2", "contentList", "blocks", "contentListV2");
  private static final List<String> WRAPPER_KEYS = List.of("results", "data");
  private static final List<String> BLOCK_FIELD_HINTS =
      List.of("text", "type", "content", "md", "page_idx", "content_type");
  private static final int MAX_DEPTH = 4;

  private final ObjectMapper objectMapper;
  private final BlockNormalizer blockNormalizer;

  /** Markdown and blocks read from an artifact. */
  public record Artifact(String markdown, List<Block> blocks) {}

  /**
   * Unpacks an artifact.
   *
   * @param zipBytes archive content
   * @return markdown and normalized blocks with image bytes attached
   * @throws IOException if the archive cannot be read
   */
  public Artifact read(byte[] zipBytes) throws IOException {
    Map<String, byte[]> entries = unzip(zipBytes);

    List<String> markdownParts = new ArrayList<>();
    List<?> rawBlocks = List.of();
    String blockSource = null;
    Map<String, byte[]> images = new TreeMap<>();

    for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
      String name = entry.getKey();
      if (name.endsWith(".md")) {
        markdownParts.add(new String(entry.getValue(), StandardCharsets.UTF_8));
      } else if (ImageBytesInjector.isImageName(name)) {
        images.put(name, entry.getValue());
      }
    }
    for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
      if (!entry.getKey().endsWith(".json")) {
        continue;
      }
      try {
        Object json = objectMapper.readValue(entry.getValue(), Object.class);
        List<?> found = findBlockList(json, 0);
        if (found != null && !found.isEmpty()) {
          rawBlocks = found;
          blockSource = entry.getKey();
          break;
        }
      } catch (IOException e) {
        log.debug("Skipping unreadable JSON entry {}: {}", entry.getKey(), e.getMessage());
      }
    }

    List<Block> blocks = blockNormalizer.normalizeAll(rawBlocks);
    ImageBytesInjector.inject(blocks, images);

    String markdown = String.join("\n\n", markdownParts);
    if (blockSource == null) {
      log.info("No block list found in artifact ({} entries); markdown only", entries.size());
    } else {
      log.info(
          "Read {} blocks from {} and {} markdown chars",
          blocks.size(),
          blockSource,
          markdown.length());
    }
    return new Artifact(markdown, blocks);
  }

  /**
   * Searches a decoded JSON value for a block list.
   *
   * @return the list, or null when none is found within the depth limit
   */
  static List<?> findBlockList(Object value, int depth) {
    if (depth > MAX_DEPTH) {
      return null;
    }
    if (value instanceof List<?> list) {
      return isLikelyBlockList(list) ? list : null;
    }
    if (!(value instanceof Map<?, ?> map)) {
      return null;
    }
    for (String key : BLOCK_LIST_KEYS) {
      if (map.get(key) instanceof List<?> list && isLikelyBlockList(list)) {
        return list;
      }
    }
    for (String key : WRAPPER_KEYS) {
      Object wrapped = map.get(key);
      if (wrapped instanceof List<?> list && isLikelyBlockList(list)) {
        return list;
      }
      if (wrapped instanceof Map<?, ?> inner) {
        for (Object v : inner.values()) {
          List<?> found = findBlockList(v, depth + 1);
          if (found != null) {
            return found;
          }
        }
      }
    }
    if (map.size() == 1) {
      return findBlockList(map.values().iterator().next(), depth + 1);
    }
    return null;
  }

  private static boolean isLikelyBlockList(List<?> list) {
    if (list.isEmpty() || !(list.get(0) instanceof Map<?, ?> first)) {
      return false;
    }
    return BLOCK_FIELD_HINTS.stream().anyMatch(first::containsKey);
  }

  private static Map<String, byte[]> unzip(byte[] zipBytes) throws IOException {
    Map<String, byte[]> entries = new TreeMap<>();
    try (ZipInputStream zip = new ZipInputStream(new ByteArrayInputStream(zipBytes))) {
      ZipEntry entry;
      while ((entry = zip.getNextEntry()) != null) {
        if (!entry.isDirectory()) {
          entries.put(entry.getName().replace('\\', '/'), zip.readAllBytes());
        }
      }
    }
    if (entries.isEmpty()) {
      throw new IOException("Artifact archive is empty or not a zip file");
    }
    return entries;
  }
}
