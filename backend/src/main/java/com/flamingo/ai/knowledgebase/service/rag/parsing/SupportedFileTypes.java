package com.flamingo.ai.knowledgebase.service.rag.parsing;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Upload extensions accepted by the parser chain, with their MIME types. */
public final class SupportedFileTypes {

  private static final Map<String, String> MIME_TYPES =
      Map.ofEntries(
          Map.entry("pdf", "application/pdf"),
          Map.entry(
              "docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document"),
          Map.entry("doc", "application/msword"),
          Map.entry(
              "pptx", "application/vnd.openxmlformats-officedocument.presentationml.presentation"),
          Map.entry("xlsx", "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"),
          Map.entry("xls", "application/vnd.ms-excel"),
          Map.entry("csv", "text/csv"),
          Map.entry("tsv", "text/tab-separated-values"),
          Map.entry("md", "text/markdown"),
          Map.entry("markdown", "text/markdown"),
          Map.entry("txt", "text/plain"),
          Map.entry("text", "text/plain"),
          Map.entry("mp3", "audio/mpeg"),
          Map.entry("wav", "audio/wav"),
          Map.entry("m4a", "audio/mp4"),
          Map.entry("ogg", "audio/ogg"),
          Map.entry("webm", "audio/webm"),
          Map.entry("flac", "audio/flac"));

  public static final Set<String> OFFICE = Set.of("docx", "doc", "pptx");
  public static final Set<String> SPREADSHEET = Set.of("xlsx", "xls");
  public static final Set<String> DELIMITED = Set.of("csv", "tsv");
  public static final Set<String> MARKDOWN = Set.of("md", "markdown");
  public static final Set<String> PLAIN_TEXT = Set.of("txt", "text");
  public static final Set<String> AUDIO = Set.of("mp3", "wav", "m4a", "ogg", "webm", "flac");

  private SupportedFileTypes() {}

  public static boolean isSupported(String fileName) {
    return MIME_TYPES.containsKey(extensionOf(fileName));
  }

  public static String extensionOf(String fileName) {
    if (fileName == null) {
      return "";
    }
    int dot = fileName.lastIndexOf('.');
    if (dot < 0 || dot == fileName.length() - 1) {
      return "";
    }
    return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
  }

  public static String mimeTypeOf(String fileName) {
    return MIME_TYPES.getOrDefault(extensionOf(fileName), "application/octet-stream");
  }
}
