package com.ontologymarket.common.catalog;

import java.util.List;

public record OntologyPage(List<Ontology> results, long total, int offset, int limit) {

  public OntologyPage {
    results = results == null ? List.of() : List.copyOf(results);
  }
}
