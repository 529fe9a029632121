package com.flamingo.ai.knowledgebase.service.rag.image;

import com.flamingo.ai.knowledgebase.service.rag.chunking.TokenEstimator;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Describes extracted images with the vision model: a triage call picks the image kind, then a
 * kind-specific prompt produces the description.
 */
@Service
@Slf4j
public class ImageCaptioner {

  static final String TRIAGE_PROMPT =
      """
      Classify this image. Answer with exactly one word from this list:
      FLOWCHART
      CHART
      PHOTO
      OTHER

      FLOWCHART = flowchart, architecture diagram, topology or mind map.
      CHART = bar, line or pie chart, or another data plot.
      PHOTO = photograph or screenshot.
      OTHER = anything else.""";

  static final String CHART_PROMPT =
      """
      This image is a data chart. For retrieval and understanding:
      1. List the main data as a Markdown table, with rows and columns following the legend and \
      axes.
      2. State the key values, shares or trends in one or two sentences.
      3. Mention the title, legend and axis labels if present.

      Output the table first, then the short conclusion. Do not add unrelated content.""";

  static final String PHOTO_PROMPT =
      "Write a concise description of this image that helps search and understanding.";

  static final int CHART_MAX_TOKENS = 1500;

  private static final String TRUNCATED = "\n\n[... truncated]";

  private final ChatModel visionChatModel;

  public ImageCaptioner(@Qualifier("visionChatModel") ChatModel visionChatModel) {
    this.visionChatModel = visionChatModel;
  }

  /** Result of describing one image. */
  public record Caption(ImageKind kind, String description) {}

  /**
   * Classifies and describes an image.
   *
   * @param imageBytes PNG or JPEG bytes
   * @param headingPath titles enclosing the image, outermost first
   * @return kind and description; the description is empty when the model returned nothing
   */
  @Timed(value = "rag.image.caption", description = "Time to classify and describe one image")
  public Caption describe(byte[] imageBytes, List<String> headingPath) {
    ImageKind kind = ImageKind.fromReply(ask(imageBytes, TRIAGE_PROMPT));
    String description =
        switch (kind) {
          case FLOWCHART -> ask(imageBytes, flowchartPrompt(headingPath));
          case CHART ->
              TokenEstimator.truncate(ask(imageBytes, CHART_PROMPT), CHART_MAX_TOKENS, TRUNCATED);
          default -> ask(imageBytes, PHOTO_PROMPT);
        };
    log.debug("Image classified as {} ({} chars of description)", kind, description.length());
    return new Caption(kind, description);
  }

  /**
   * Builds the chunk text of an image from its original caption and the model description.
   *
   * @param originalCaption caption reported by the parser, may be empty
   * @param extracted model description, may be empty
   * @return combined text
   */
  public static String fuse(String originalCaption, String extracted) {
    List<String> parts = new ArrayList<>();
    parts.add("[Image analysis]");
    boolean hasCaption = originalCaption != null && !originalCaption.isBlank();
    boolean hasExtracted = extracted != null && !extracted.isBlank();
    if (hasCaption) {
      parts.add("Original caption: " + originalCaption.strip());
    }
    if (hasExtracted) {
      parts.add("Extracted:\n" + extracted.strip());
    }
    if (!hasCaption && !hasExtracted) {
      parts.add("(no description available)");
    }
    return String.join("\n", parts);
  }

  static String flowchartPrompt(List<String> headingPath) {
    String context =
        headingPath == null || headingPath.isEmpty() ? "none" : String.join(" > ", headingPath);
    return """
        You are a senior architecture analyst. The image appears in the document section: %s.
        1. Describe every core component or module shown in the diagram.
        2. List the connections between them: data flow, control flow or dependencies.
        3. Use precise engineering terms and answer as a Markdown list."""
        .formatted(context);
  }

  private String ask(byte[] imageBytes, String prompt) {
    String base64 = Base64.getEncoder().encodeToString(imageBytes);
    UserMessage message =
        UserMessage.from(
            TextContent.from(prompt), ImageContent.from(base64, mimeType(imageBytes)));
    String reply = visionChatModel.chat(message).aiMessage().text();
    return reply == null ? "" : reply.strip();
  }

  static String mimeType(byte[] bytes) {
    if (bytes.length > 2 && (bytes[0] & 0xFF) == 0xFF && (bytes[1] & 0xFF) == 0xD8) {
      return "image/jpeg";
    }
    return "image/png";
  }
}
