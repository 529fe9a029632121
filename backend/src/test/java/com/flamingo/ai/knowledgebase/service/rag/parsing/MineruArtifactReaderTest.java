package com.flamingo.ai.knowledgebase.service.rag.parsing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MineruArtifactReader Tests")
class MineruArtifactReaderTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private final MineruArtifactReader reader =
      new MineruArtifactReader(objectMapper, new BlockNormalizer(objectMapper));

  private static byte[] zip(Map<String, byte[]> entries) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(out)) {
      for (Map.Entry<String, byte[]> entry : entries.entrySet()) {
        zip.putNextEntry(new ZipEntry(entry.getKey()));
        zip.write(entry.getValue());
        zip.closeEntry();
      }
    }
    return out.toByteArray();
  }

  @Test
  @DisplayName("Should read markdown, blocks and image bytes from an archive")
  void shouldReadArchive() throws IOException {
    // Given
    String contentList =
        "[{\"type\":\"text\",\"text\":\"Intro\",\"page_idx\":0},"
            + "{\"type\":\"image\",\"img_path\":\"images/abc.png\",\"page_idx\":1}]";
    Map<String, byte[]> entries = new LinkedHashMap<>();
    entries.put("out/full.md", "# Paper".getBytes(StandardCharsets.UTF_8));
    entries.put("out/layout.json", "{\"pdf_info\":[]}".getBytes(StandardCharsets.UTF_8));
    entries.put("out/x_content_list.json", contentList.getBytes(StandardCharsets.UTF_8));
    entries.put("out/images/abc.png", new byte[] {1, 2, 3});

    // When
    MineruArtifactReader.Artifact artifact = reader.read(zip(entries));

    // Then
    assertThat(artifact.markdown()).isEqualTo("# Paper");
    assertThat(artifact.blocks()).hasSize(2);
    assertThat(artifact.blocks().get(1).getImageBytes()).containsExactly(1, 2, 3);
  }

  @Test
  @DisplayName("Should find block lists nested in result wrappers")
  void shouldFindNestedBlockList() {
    Map<String, Object> json =
        Map.of("results", Map.of("paper", Map.of("content_list", List.of(Map.of("text", "a")))));

    assertThat(MineruArtifactReader.findBlockList(json, 0)).hasSize(1);
  }

  @Test
  @DisplayName("Should reject bytes that are not an archive")
  void shouldRejectNonArchive() {
    assertThatThrownBy(() -> reader.read("not a zip".getBytes(StandardCharsets.UTF_8)))
        .isInstanceOf(IOException.class);
  }
}
