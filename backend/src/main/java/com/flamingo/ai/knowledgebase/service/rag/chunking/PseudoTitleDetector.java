package com.flamingo.ai.knowledgebase.service.rag.chunking;

import java.util.List;
import java.util.regex.Pattern;

/** Recognizes heading lines that a layout model labelled as plain text. */
final class PseudoTitleDetector {

  private static final List<Pattern> PATTERNS =
      List.of(
          Pattern.compile("^\\s{0,3}#{1,6}\\s+\\S+"),
          Pattern.compile("^\\s*(第[一二三四五六七八九十百千万0-9]+[章节部分篇])"),
          Pattern.compile("^\\s*(\\d+(?:\\.\\d+){0,3}|[一二三四五六七八九十]+)\\s*[、.)）．]\\s*\\S+"),
          Pattern.compile("^\\s*(附录|目录|前言|引言|总结|结论|参考文献|致谢)\\s*$"),
          Pattern.compile(
              "^\\s*(Abstract|Introduction|Conclusions?|References|Appendix"
                  + "|Acknowledgements?)\\s*$",
              Pattern.CASE_INSENSITIVE));

  private static final Pattern SENTENCE_END = Pattern.compile("[。！？!?；;]$");

  private PseudoTitleDetector() {}

  static boolean isPseudoTitle(String text, int maxChars) {
    String s = text == null ? "" : text.strip();
    if (s.isEmpty() || s.indexOf('\n') >= 0 || s.length() > maxChars) {
      return false;
    }
    if (SENTENCE_END.matcher(s).find()) {
      return false;
    }
    return PATTERNS.stream().anyMatch(p -> p.matcher(s).find());
  }
}
