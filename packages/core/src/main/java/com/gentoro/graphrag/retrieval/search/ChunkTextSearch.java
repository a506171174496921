package com.gentoro.graphrag.retrieval.search;

import com.gentoro.graphrag.exception.SignalSearchException;
import com.gentoro.graphrag.graph.ChunkRecord;
import com.gentoro.graphrag.graph.driver.GraphDriver;
import com.gentoro.graphrag.retrieval.QueryIntent;
import com.gentoro.graphrag.strategy.RetrievalStrategy;
import com.gentoro.graphrag.strategy.TextSearchMethod;
import com.gentoro.graphrag.utility.StringUtility;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.ToIntFunction;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Matches the intent's search text against chunk text with the strategy's method.
 *
 * <ul>
 *   <li>{@code contains}: occurrences of the text, normalized by the best hit
 *   <li>{@code fulltext}: share of the query's significant terms present in the chunk
 *   <li>{@code regex}: pattern matches, normalized by the best hit
 * </ul>
 *
 * Every match is scored before the best {@value SignalSearcher#CANDIDATE_LIMIT} are kept.
 */
public class ChunkTextSearch implements SignalSearcher {

  @Override
  public Signal signal() {
    return Signal.CHUNK_TEXT_SEARCH;
  }

  @Override
  public boolean isApplicable(QueryIntent intent, RetrievalStrategy strategy) {
    return intent.hasSearchText();
  }

  @Override
  public List<ScoredCandidate> search(
      QueryIntent intent, RetrievalStrategy strategy, GraphDriver driver) {
    TextSearchMethod method = strategy.search().chunkTextSearch().method();
    String query = intent.searchText();
    List<ScoredCandidate> scored =
        switch (method) {
          case CONTAINS -> normalized(
              driver.searchChunks(method, query, intent.documentId(), GraphDriver.UNLIMITED),
              chunk -> StringUtility.countOccurrences(chunk.text(), query));
          case FULLTEXT -> fulltext(driver, query, intent.documentId());
          case REGEX -> {
            Pattern pattern = compile(query);
            yield normalized(
                driver.searchChunks(method, query, intent.documentId(), GraphDriver.UNLIMITED),
                chunk -> countMatches(pattern, chunk.textOrEmpty()));
          }
        };
    return SignalSearcher.best(scored, CANDIDATE_LIMIT);
  }

  private List<ScoredCandidate> fulltext(GraphDriver driver, String query, String documentId) {
    Set<String> terms = StringUtility.significantTerms(query);
    if (terms.isEmpty()) return List.of();
    List<ScoredCandidate> out = new ArrayList<>();
    for (ChunkRecord chunk :
        driver.searchChunks(TextSearchMethod.FULLTEXT, query, documentId, GraphDriver.UNLIMITED)) {
      Set<String> words = new HashSet<>(StringUtility.words(chunk.text()));
      long present = terms.stream().filter(words::contains).count();
      if (present > 0) {
        out.add(ScoredCandidate.chunk(signal(), chunk, (double) present / terms.size()));
      }
    }
    return out;
  }

  private List<ScoredCandidate> normalized(
      List<ChunkRecord> hits, ToIntFunction<ChunkRecord> counter) {
    int[] counts = new int[hits.size()];
    int max = 0;
    for (int i = 0; i < hits.size(); i++) {
      counts[i] = counter.applyAsInt(hits.get(i));
      max = Math.max(max, counts[i]);
    }
    List<ScoredCandidate> out = new ArrayList<>();
    for (int i = 0; i < hits.size(); i++) {
      if (counts[i] > 0) {
        out.add(ScoredCandidate.chunk(signal(), hits.get(i), (double) counts[i] / max));
      }
    }
    return out;
  }

  private Pattern compile(String query) {
    try {
      return Pattern.compile(query, Pattern.CASE_INSENSITIVE);
    } catch (PatternSyntaxException e) {
      throw new SignalSearchException(
          signal().id(), "Invalid regular expression: " + e.getDescription(), e);
    }
  }

  private static int countMatches(Pattern pattern, String text) {
    Matcher m = pattern.matcher(text);
    int count = 0;
    while (m.find()) {
      count++;
    }
    return count;
  }
}
