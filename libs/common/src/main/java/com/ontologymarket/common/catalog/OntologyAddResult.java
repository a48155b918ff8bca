package com.ontologymarket.common.catalog;

import java.util.List;

public record OntologyAddResult(List<Ontology> created, int skipped) {

  public OntologyAddResult {
    created = created == null ? List.of() : List.copyOf(created);
  }
}
