package com.gentoro.graphrag.testing;

import com.gentoro.graphrag.graph.EntityKey;
import com.gentoro.graphrag.graph.driver.memory.InMemoryGraphDriver;
import com.gentoro.graphrag.ingestion.ChunkInput;
import com.gentoro.graphrag.ingestion.DocumentInput;
import com.gentoro.graphrag.ingestion.ExtractedEntity;
import com.gentoro.graphrag.ingestion.ExtractedRelationship;
import com.gentoro.graphrag.ingestion.ExtractionResult;
import com.gentoro.graphrag.ingestion.IngestionService;
import com.gentoro.graphrag.schema.SchemaDescriptor;
import com.gentoro.graphrag.schema.SchemaLoader;
import com.gentoro.graphrag.schema.SchemaValidator;
import com.gentoro.graphrag.strategy.PresetRegistry;
import com.gentoro.graphrag.strategy.StrategyStore;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/** A three-chunk services agreement with one party, used across ingestion and retrieval tests. */
public final class ContractFixtures {
  public static final String DOC_ID = "doc";
  public static final EntityKey ACME = EntityKey.of("Party", "acme");
  public static final EntityKey CONTRACT = EntityKey.of("Contract", "msa");
  public static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-01T00:00:00Z"), ZoneOffset.UTC);

  private static final PresetRegistry PRESETS =
      PresetRegistry.fromClasspath(PresetRegistry.DEFAULT_RESOURCE);

  private ContractFixtures() {}

  public static PresetRegistry presets() {
    return PRESETS;
  }

  public static StrategyStore strategies(String preset) {
    return new StrategyStore(PRESETS, preset);
  }

  public static SchemaDescriptor schema() {
    return SchemaLoader.load("classpath:schemas/contracts.yaml");
  }

  public static SchemaValidator validator() {
    return new SchemaValidator(schema());
  }

  public static InMemoryGraphDriver driver() {
    InMemoryGraphDriver driver = new InMemoryGraphDriver();
    driver.initialize();
    return driver;
  }

  public static DocumentInput document() {
    return new DocumentInput(DOC_ID, "services-agreement.pdf", 2);
  }

  public static List<ChunkInput> chunks() {
    return List.of(
        ChunkInput.of(0, "This Services Agreement is entered into on January 1, 2024.", 1),
        ChunkInput.of(1, "Acme Corporation agrees to deliver the software within 30 days.", 1),
        ChunkInput.of(2, "Payment is due upon delivery. The buyer pays the invoice in full.", 2));
  }

  /** Only Acme, extracted from chunk 1. */
  public static ExtractionResult acmeOnly() {
    return new ExtractionResult(
        List.of(
            ExtractedEntity.of(
                "Party", "acme", Map.of("name", "Acme Corporation", "role", "supplier"), 1)),
        List.of());
  }

  /** Acme party to the agreement itself, extracted from chunk 0. */
  public static ExtractionResult acmeAndContract() {
    return new ExtractionResult(
        List.of(
            ExtractedEntity.of(
                "Party", "acme", Map.of("name", "Acme Corporation", "role", "supplier"), 1),
            ExtractedEntity.of("Contract", "msa", Map.of("title", "Services Agreement"), 0)),
        List.of(ExtractedRelationship.of("PARTY_TO", ACME, CONTRACT)));
  }

  /** Ingests the agreement under the given preset and returns the populated driver. */
  public static InMemoryGraphDriver ingested(
      StrategyStore strategies, ExtractionResult extraction) {
    InMemoryGraphDriver driver = driver();
    new IngestionService(driver, strategies, validator(), CLOCK)
        .ingest(document(), chunks(), extraction);
    return driver;
  }
}
