package com.gentoro.graphrag.utility;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TokenEstimatorTest {

  @Test
  @DisplayName("empty and null text cost nothing")
  void emptyText() {
    assertEquals(0, TokenEstimator.estimateTokens(null));
    assertEquals(0, TokenEstimator.estimateTokens(""));
  }

  @Test
  @DisplayName("short text costs at least one token")
  void shortText() {
    assertEquals(1, TokenEstimator.estimateTokens("a"));
    assertEquals(1, TokenEstimator.estimateTokens("abc"));
  }

  @Test
  @DisplayName("roughly four characters per token")
  void fourCharsPerToken() {
    assertEquals(25, TokenEstimator.estimateTokens("x".repeat(100)));
    assertEquals(25, TokenEstimator.estimateTokens("x".repeat(103)));
  }

  @Test
  @DisplayName("truncation cuts at a word boundary")
  void truncateAtWord() {
    String text = "alpha beta gamma delta epsilon";
    String cut = TokenEstimator.truncateToTokens(text, 3);
    assertEquals("alpha beta", cut);
    assertTrue(cut.length() <= 12);
  }

  @Test
  @DisplayName("text within budget is returned unchanged")
  void truncateNoop() {
    assertEquals("short", TokenEstimator.truncateToTokens("short", 10));
    assertEquals("", TokenEstimator.truncateToTokens("anything", 0));
    assertEquals("", TokenEstimator.truncateToTokens(null, 5));
  }
}
