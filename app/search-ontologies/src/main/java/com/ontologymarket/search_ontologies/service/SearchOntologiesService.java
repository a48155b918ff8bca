package com.ontologymarket.search_ontologies.service;

import com.ontologymarket.common.catalog.InvalidOntologyRequestException;
import com.ontologymarket.common.catalog.OntologyCatalog;
import com.ontologymarket.common.catalog.OntologyPage;
import com.ontologymarket.common.catalog.OntologyResponse;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class SearchOntologiesService {

  public static final int MAX_LIMIT = 100;

  private final OntologyCatalog ontologyCatalog;

  /**
   * Searches listings. {@code limit} is clamped to 1..100 and {@code offset} to at least 0.
   *
   * @throws InvalidOntologyRequestException if a paging parameter is not an integer
   */
  public OntologyResponse search(String searchTerm, String limit, String offset) {
    final int clampedLimit = Math.min(Math.max(1, parseInt("limit", limit, MAX_LIMIT)), MAX_LIMIT);
    final int clampedOffset = Math.max(0, parseInt("offset", offset, 0));
    final String term = searchTerm == null || searchTerm.isEmpty() ? null : searchTerm;

    final OntologyPage page = ontologyCatalog.search(term, clampedLimit, clampedOffset);

    final Map<String, Object> data = new LinkedHashMap<>();
    data.put("results", page.results());
    data.put("count", page.results().size());
    data.put("total", page.total());
    data.put("offset", page.offset());
    data.put("limit", page.limit());
    return OntologyResponse.ok("Ontologies retrieved successfully", data);
  }

  private int parseInt(String name, String value, int defaultValue) {
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      throw new InvalidOntologyRequestException(name + " must be an integer", ex);
    }
  }
}
