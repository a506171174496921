package com.gentoro.graphrag.utility;

/**
 * Heuristic token counting: one token is roughly four characters for most LLM tokenizers. Used to
 * keep assembled contexts inside {@code limits.max_context_tokens}.
 */
public final class TokenEstimator {
  public static final int CHARS_PER_TOKEN = 4;

  private TokenEstimator() {}

  public static int estimateTokens(String text) {
    if (text == null || text.isEmpty()) return 0;
    return Math.max(1, text.length() / CHARS_PER_TOKEN);
  }

  /** Prefix of {@code text} that fits in roughly {@code maxTokens}, cut at a word boundary. */
  public static String truncateToTokens(String text, int maxTokens) {
    if (text == null) return "";
    if (maxTokens <= 0) return "";
    int maxChars = maxTokens * CHARS_PER_TOKEN;
    if (text.length() <= maxChars) return text;
    int cut = text.lastIndexOf(' ', maxChars);
    if (cut <= 0) cut = maxChars;
    return text.substring(0, cut).trim();
  }
}
