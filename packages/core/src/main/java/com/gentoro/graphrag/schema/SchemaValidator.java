package com.gentoro.graphrag.schema;

import com.gentoro.graphrag.graph.EntityKey;
import com.gentoro.graphrag.graph.EntityRecord;
import com.gentoro.graphrag.graph.RelationshipRecord;
import com.gentoro.graphrag.schema.ValidationIssue.Kind;
import com.gentoro.graphrag.schema.ValidationIssue.Severity;
import com.gentoro.graphrag.strategy.ExtractionStrategy;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Checks entities and relationships against a {@link SchemaDescriptor}. Unknown types are always
 * errors; missing required properties and missing endpoints are errors or warnings depending on
 * the validation flags of the extraction strategy.
 */
public final class SchemaValidator {
  private final SchemaDescriptor schema;

  public SchemaValidator(SchemaDescriptor schema) {
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  public SchemaDescriptor schema() {
    return schema;
  }

  public List<ValidationIssue> checkEntity(
      EntityRecord entity, ExtractionStrategy.Validation validation) {
    List<ValidationIssue> issues = new ArrayList<>();
    String subject = entity.key().toString();
    if (!schema.hasEntityType(entity.type())) {
      issues.add(
          new ValidationIssue(
              Severity.ERROR,
              Kind.UNKNOWN_ENTITY_TYPE,
              subject,
              "Entity type '%s' is not defined by schema '%s'"
                  .formatted(entity.type(), schema.name())));
      return issues;
    }
    Severity missingSeverity =
        Boolean.TRUE.equals(validation.failOnMissingRequired()) ? Severity.ERROR : Severity.WARNING;
    for (String prop : schema.requiredFor(entity.type())) {
      Object value = entity.properties().get(prop);
      if (value == null || (value instanceof String s && s.isBlank())) {
        issues.add(
            new ValidationIssue(
                missingSeverity,
                Kind.MISSING_REQUIRED_PROPERTY,
                subject,
                "Required property '%s' is missing".formatted(prop)));
      }
    }
    return issues;
  }

  /**
   * @param endpointExists resolves whether an endpoint entity is stored or part of the same batch
   */
  public List<ValidationIssue> checkRelationship(
      RelationshipRecord rel,
      Predicate<EntityKey> endpointExists,
      ExtractionStrategy.Validation validation) {
    List<ValidationIssue> issues = new ArrayList<>();
    String subject = rel.identity();
    if (!schema.hasRelationshipType(rel.type())) {
      issues.add(
          new ValidationIssue(
              Severity.ERROR,
              Kind.UNKNOWN_RELATIONSHIP_TYPE,
              subject,
              "Relationship type '%s' is not defined by schema '%s'"
                  .formatted(rel.type(), schema.name())));
    } else {
      SchemaDescriptor.Endpoints declared = schema.relationshipEndpoints().get(rel.type());
      if (declared != null
          && (!declared.source().equals(rel.source().type())
              || !declared.target().equals(rel.target().type()))) {
        issues.add(
            new ValidationIssue(
                Severity.ERROR,
                Kind.ENDPOINT_TYPE_MISMATCH,
                subject,
                "Expected %s -> %s but got %s -> %s"
                    .formatted(
                        declared.source(),
                        declared.target(),
                        rel.source().type(),
                        rel.target().type())));
      }
    }
    Severity brokenSeverity =
        Boolean.TRUE.equals(validation.failOnBrokenRelationships())
            ? Severity.ERROR
            : Severity.WARNING;
    for (EntityKey endpoint : List.of(rel.source(), rel.target())) {
      if (!endpointExists.test(endpoint)) {
        issues.add(
            new ValidationIssue(
                brokenSeverity,
                Kind.MISSING_ENDPOINT,
                subject,
                "Endpoint %s does not exist".formatted(endpoint)));
      }
    }
    return issues;
  }
}
