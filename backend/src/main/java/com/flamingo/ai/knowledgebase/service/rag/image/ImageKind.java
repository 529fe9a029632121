package com.flamingo.ai.knowledgebase.service.rag.image;

import java.util.Locale;

/** Triage category of an extracted image; selects the description prompt. */
public enum ImageKind {
  FLOWCHART,
  CHART,
  PHOTO,
  OTHER;

  /** Reads the first category name found in a model reply; {@link #OTHER} when none matches. */
  static ImageKind fromReply(String reply) {
    if (reply == null || reply.isBlank()) {
      return OTHER;
    }
    String upper = reply.strip().toUpperCase(Locale.ROOT);
    for (ImageKind kind : values()) {
      if (upper.contains(kind.name())) {
        return kind;
      }
    }
    return OTHER;
  }
}
