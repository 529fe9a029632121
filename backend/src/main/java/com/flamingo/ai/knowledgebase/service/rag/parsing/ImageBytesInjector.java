package com.flamingo.ai.knowledgebase.service.rag.parsing;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;

/**
 * Attaches image bytes delivered next to a block list (zip entries, base64 maps) to the image
 * blocks that reference them.
 *
 * <p>A block is matched by its image path: exact name, then path suffix, then file name. Blocks
 * left without bytes take the remaining images in name order.
 */
@Slf4j
final class ImageBytesInjector {

  private static final List<String> IMAGE_SUFFIXES =
      List.of(".png", ".jpg", ".jpeg", ".webp", ".gif", ".bmp");

  private ImageBytesInjector() {}

  static boolean isImageName(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return !lower.endsWith("/") && IMAGE_SUFFIXES.stream().anyMatch(lower::endsWith);
  }

  /**
   * Injects bytes into image blocks.
   *
   * @param blocks normalized blocks, mutated in place
   * @param images image name to bytes, iterated in its own order for the positional fallback
   * @return number of blocks that received bytes
   */
  static int inject(List<Block> blocks, Map<String, byte[]> images) {
    if (images.isEmpty()) {
      return 0;
    }
    Set<String> used = new HashSet<>();
    List<Block> unmatched = new ArrayList<>();
    int injected = 0;

    for (Block block : blocks) {
      if (block.family() != BlockFamily.IMAGE || block.hasImage()) {
        continue;
      }
      String name = findByPath(images, block.getImagePath());
      if (name != null) {
        block.setImageBytes(images.get(name));
        used.add(name);
        injected++;
      } else {
        unmatched.add(block);
      }
    }

    for (Block block : unmatched) {
      for (Map.Entry<String, byte[]> entry : images.entrySet()) {
        if (used.add(entry.getKey())) {
          block.setImageBytes(entry.getValue());
          injected++;
          break;
        }
      }
    }
    if (injected > 0) {
      log.info("Attached bytes to {} image blocks ({} images available)", injected, images.size());
    }
    return injected;
  }

  private static String findByPath(Map<String, byte[]> images, String path) {
    if (path == null || path.isBlank()) {
      return null;
    }
    String normalized = normalize(path);
    String baseName = normalized.substring(normalized.lastIndexOf('/') + 1);
    for (String name : images.keySet()) {
      String candidate = name.replace('\\', '/');
      if (candidate.equals(normalized)
          || candidate.endsWith("/" + normalized)
          || candidate.endsWith(normalized)) {
        return name;
      }
    }
    for (String name : images.keySet()) {
      String candidate = name.replace('\\', '/');
      if (candidate.substring(candidate.lastIndexOf('/') + 1).equals(baseName)) {
        return name;
      }
    }
    return null;
  }

  private static String normalize(String path) {
    String p = path.strip().replace('\\', '/');
    int start = 0;
    while (start < p.length() && (p.charAt(start) == '.' || p.charAt(start) == '/')) {
      start++;
    }
    return p.substring(start);
  }
}
