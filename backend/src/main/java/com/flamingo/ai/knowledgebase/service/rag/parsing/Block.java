package com.flamingo.ai.knowledgebase.service.rag.parsing;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A normalized content unit produced by any parser backend.
 *
 * <p>Blocks are pipeline-internal and never persisted. The image preprocessor mutates the image
 * fields in place.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Block {

  private BlockType type;

  @Builder.Default private String text = "";

  /** Raw table body (HTML or markdown) when the backend reports it separately from the text. */
  private String tableBody;

  /** Zero-based page indexes the block spans. */
  @Builder.Default private List<Integer> pageNumbers = new ArrayList<>();

  private byte[] imageBytes;

  /** Retrievable URL once the image has been uploaded. */
  private String imageUrl;

  /** Archive-relative image path reported by the backend, used to locate image bytes. */
  private String imagePath;

  /** Titles enclosing the block, outermost first. Filled by the image preprocessor. */
  @Builder.Default private List<String> headingPath = new ArrayList<>();

  /** True once a vision caption has been merged into {@link #text}. */
  private boolean captioned;

  public BlockFamily family() {
    return type == null ? BlockFamily.TEXT : type.family();
  }

  public boolean hasImage() {
    return imageBytes != null && imageBytes.length > 0;
  }

  /** Text used for display and chunk content; tables prefer their body. */
  public String displayText() {
    if (family() == BlockFamily.TABLE && tableBody != null && !tableBody.isBlank()) {
      return tableBody.strip();
    }
    return text == null ? "" : text.strip();
  }

  /** True if the block carries nothing a chunk could use. */
  public boolean isEmpty() {
    return displayText().isEmpty() && !hasImage() && (imageUrl == null || imageUrl.isBlank());
  }

  public static Block text(BlockType type, String text, int page) {
    return Block.builder()
        .type(type)
        .text(text)
        .pageNumbers(new ArrayList<>(List.of(page)))
        .build();
  }
}
