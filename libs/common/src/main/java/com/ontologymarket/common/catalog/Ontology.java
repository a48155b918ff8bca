package com.ontologymarket.common.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Ontology(
    String uuid,
    String name,
    String sourceUrl,
    String imageUrl,
    String description,
    Integer nodeCount,
    Double score,
    Integer relationshipCount,
    @JsonProperty("is_public") boolean isPublic,
    String ownerEmail,
    Instant createdAt) {

  public static Ontology create(
      String uuid, NewOntology source, String ownerEmail, Instant createdAt) {
    return new Ontology(
        uuid,
        source.name(),
        source.sourceUrl(),
        source.imageUrl(),
        source.description(),
        source.nodeCount(),
        source.score(),
        source.relationshipCount(),
        Boolean.TRUE.equals(source.isPublic()),
        ownerEmail,
        createdAt);
  }
}
