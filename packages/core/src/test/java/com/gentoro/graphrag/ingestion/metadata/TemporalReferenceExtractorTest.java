package com.gentoro.graphrag.ingestion.metadata;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class TemporalReferenceExtractorTest {

  private static final String CLAUSE =
      "Payment is due within thirty (30) days after January 15, 2024 and 2024-03-31.";

  @Test
  @DisplayName("dates and durations are returned in order of appearance")
  void datesAndDurations() {
    TemporalReferenceExtractor extractor = new TemporalReferenceExtractor(true, true, false);
    assertEquals(
        List.of("thirty (30) days", "January 15, 2024", "2024-03-31"), extractor.extract(CLAUSE));
  }

  @Test
  @DisplayName("disabled categories are not extracted")
  void onlyDates() {
    TemporalReferenceExtractor extractor = new TemporalReferenceExtractor(true, false, false);
    assertEquals(List.of("January 15, 2024", "2024-03-31"), extractor.extract(CLAUSE));
  }

  @Test
  @DisplayName("relative phrases are recognized when enabled")
  void relative() {
    TemporalReferenceExtractor extractor = new TemporalReferenceExtractor(false, false, true);
    List<String> refs =
        extractor.extract("This Agreement starts on the Effective Date and ends upon termination.");
    assertEquals(List.of("Effective Date", "upon termination"), refs);
  }

  @Test
  @DisplayName("quarters and fiscal years count as dates")
  void quartersAndFiscalYears() {
    TemporalReferenceExtractor extractor = new TemporalReferenceExtractor(true, false, false);
    assertEquals(
        List.of("Q3 2023", "FY2024"), extractor.extract("Revenue in Q3 2023 beat FY2024."));
  }

  @Test
  @DisplayName("blank text yields nothing")
  void blank() {
    assertTrue(new TemporalReferenceExtractor(true, true, true).extract("  ").isEmpty());
  }
}
