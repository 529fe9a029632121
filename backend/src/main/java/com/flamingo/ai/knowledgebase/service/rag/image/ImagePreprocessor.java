package com.flamingo.ai.knowledgebase.service.rag.image;

import com.flamingo.ai.knowledgebase.config.RagConfig;
import com.flamingo.ai.knowledgebase.domain.entity.Document;
import com.flamingo.ai.knowledgebase.exception.StorageException;
import com.flamingo.ai.knowledgebase.service.rag.parsing.Block;
import com.flamingo.ai.knowledgebase.service.rag.parsing.BlockFamily;
import com.flamingo.ai.knowledgebase.service.rag.parsing.BlockType;
import com.flamingo.ai.knowledgebase.service.storage.BlobStore;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Uploads the images found in parsed blocks and, when enabled, replaces their text with a vision
 * description fused with the original caption.
 *
 * <p>Failures are logged and leave the block as it was; they never fail the document.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ImagePreprocessor {

  static final String IMAGE_PREFIX = "rag/images";

  private final BlobStore blobStore;
  private final ImageCaptioner imageCaptioner;
  private final RagConfig ragConfig;

  /**
   * Processes image blocks in place.
   *
   * @param blocks parsed blocks in reading order
   * @param document owning document, used for object keys
   * @param recaption describe images again even if they were captioned before
   * @return the same list
   */
  public List<Block> preprocess(List<Block> blocks, Document document, boolean recaption) {
    boolean captionEnabled = ragConfig.getImage().isCaptionEnabled();
    List<String> headings = new ArrayList<>();
    int uploaded = 0;
    int captioned = 0;

    for (Block block : blocks) {
      if (block.getType() == BlockType.TITLE && !block.displayText().isEmpty()) {
        headings.add(block.displayText());
      }
      if (block.family() != BlockFamily.IMAGE || !block.hasImage()) {
        continue;
      }
      block.setHeadingPath(List.copyOf(headings));

      if (isBlank(block.getImageUrl()) && upload(block, document)) {
        uploaded++;
      }
      if (captionEnabled && (recaption || !block.isCaptioned()) && caption(block)) {
        captioned++;
      }
    }
    if (uploaded > 0 || captioned > 0) {
      log.info(
          "Document {}: uploaded {} images, captioned {}", document.getId(), uploaded, captioned);
    }
    return blocks;
  }

  private boolean upload(Block block, Document document) {
    String contentType = ImageCaptioner.mimeType(block.getImageBytes());
    String extension = "image/jpeg".equals(contentType) ? "jpg" : "png";
    String key =
        imagePrefix(document) + UUID.randomUUID().toString().replace("-", "") + "." + extension;
    try {
      blobStore.put(key, block.getImageBytes(), contentType);
      block.setImageUrl(blobStore.presignedUrl(key, ragConfig.getImage().getUrlExpiry()));
      return true;
    } catch (StorageException e) {
      log.warn("Image upload failed for document {}: {}", document.getId(), e.getMessage());
      return false;
    }
  }

  private boolean caption(Block block) {
    String original = block.displayText();
    try {
      ImageCaptioner.Caption caption =
          imageCaptioner.describe(block.getImageBytes(), block.getHeadingPath());
      block.setText(ImageCaptioner.fuse(original, caption.description()));
      block.setCaptioned(true);
      return true;
    } catch (RuntimeException e) {
      log.warn("Image captioning failed, keeping original caption: {}", e.getMessage());
      return false;
    }
  }

  /** Key prefix of every image extracted from a document. */
  public static String imagePrefix(Document document) {
    return String.format(
        "%s/%s/%s/", IMAGE_PREFIX, document.getCollectionId(), document.getId());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
