package com.ontologymarket.common.catalog;

import java.util.List;

/**
 * Storage-agnostic contract for ontology listings.
 *
 * <p>Every method expects an already authenticated owner; callers must never pass identities
 * that did not come out of the endpoint guard.
 */
public interface OntologyCatalog {

  /**
   * Searches listings whose name or description contains {@code searchTerm}, newest first.
   *
   * @param searchTerm substring to match, or {@code null} for every listing
   * @param limit page size, already clamped by the caller
   * @param offset number of listings to skip, already clamped by the caller
   */
  OntologyPage search(String searchTerm, int limit, int offset);

  /** Stores new listings for {@code ownerEmail}, skipping any whose source URL already exists. */
  OntologyAddResult add(List<NewOntology> ontologies, String ownerEmail);

  /**
   * Deletes the listings among {@code ontologyIds} that {@code ownerEmail} owns.
   *
   * @return number of listings actually deleted
   */
  int delete(List<String> ontologyIds, String ownerEmail);
}
