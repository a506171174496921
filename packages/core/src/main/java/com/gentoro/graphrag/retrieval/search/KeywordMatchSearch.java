package com.gentoro.graphrag.retrieval.search;

import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.retrieval.QueryIntent;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores chunks by the share of intent keywords found among their key terms. A keyword matches a
 * key term when either contains the other, ignoring case.
 */
public class KeywordMatchSearch implements SignalSearcher {

  @Override
  public Signal signal() {
    return Signal.KEYWORD_MATCHING;
  }

  @Override
  public boolean isApplicable(QueryIntent intent, RetrievalStrategy strategy) {
    return !intent.keywords().isEmpty();
  }

  @Override
  public List<ScoredCandidate> search(
      QueryIntent intent, RetrievalStrategy strategy, GraphDriver driver) {
    double threshold = strategy.search().keywordMatching().matchThreshold();
    List<String> keywords = intent.keywords();
    List<ScoredCandidate> out = new ArrayList<>();
    for (ChunkRecord chunk :
        driver.chunksByKeyTerms(keywords, intent.documentId(), GraphDriver.UNLIMITED)) {
      double score = overlap(keywords, chunk.keyTermsOrEmpty());
      if (score > 0 && score >= threshold) {
        out.add(ScoredCandidate.chunk(signal(), chunk, score));
      }
    }
    return SignalSearcher.best(out, CANDIDATE_LIMIT);
  }

  static double overlap(List<String> keywords, List<String> keyTerms) {
    if (keywords.isEmpty()) return 0.0;
    int matched = 0;
    for (String keyword : keywords) {
      String k = keyword.toLowerCase(Locale.ROOT);
      for (String term : keyTerms) {
        if (term == null || term.isBlank()) continue;
        String t = term.toLowerCase(Locale.ROOT);
        if (t.contains(k) || k.contains(t)) {
          matched++;
          break;
        }
      }
    }
    return (double) matched / keywords.size();
  }
}
