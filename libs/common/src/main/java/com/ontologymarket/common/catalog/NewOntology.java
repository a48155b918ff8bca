package com.ontologymarket.common.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;

/** Listing submitted by a caller, before the catalog assigns identity and ownership. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record NewOntology(
    @NotBlank String name,
    @NotBlank String sourceUrl,
    String imageUrl,
    String description,
    @PositiveOrZero Integer nodeCount,
    Double score,
    @PositiveOrZero Integer relationshipCount,
    @JsonProperty("is_public") Boolean isPublic) {

  public NewOntology {
    isPublic = isPublic != null && isPublic;
  }
}
