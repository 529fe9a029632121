package com.flamingo.ai.knowledgebase.service.rag.parsing;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/** Decodes uploaded text files: UTF-8, then GBK, then lenient UTF-8. */
final class TextDecoding {

  private static final Charset GBK = Charset.forName("GBK");

  private TextDecoding() {}

  static String decode(byte[] bytes) {
    int offset = hasUtf8Bom(bytes) ? 3 : 0;
    ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, bytes.length - offset);
    for (Charset charset : new Charset[] {StandardCharsets.UTF_8, GBK}) {
      try {
        return charset
            .newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT)
            .decode(buffer.duplicate())
            .toString();
      } catch (CharacterCodingException e) {
        // try the next charset
      }
    }
    return new String(bytes, offset, bytes.length - offset, StandardCharsets.UTF_8);
  }

  private static boolean hasUtf8Bom(byte[] bytes) {
    return bytes.length >= 3
        && (bytes[0] & 0xFF) == 0xEF
        && (bytes[1] & 0xFF) == 0xBB
        && (bytes[2] & 0xFF) == 0xBF;
  }
}
