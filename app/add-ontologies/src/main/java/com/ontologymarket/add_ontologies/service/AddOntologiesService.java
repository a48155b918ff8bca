package com.ontologymarket.add_ontologies.service;

import com.ontologymarket.common.catalog.NewOntology;
import com.ontologymarket.common.catalog.OntologyAddResult;
import com.ontologymarket.common.catalog.OntologyCatalog;
import com.ontologymarket.common.catalog.OntologyRequestReader;
import com.ontologymarket.common.catalog.OntologyResponse;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class AddOntologiesService {

  private final OntologyRequestReader ontologyRequestReader;
  private final OntologyCatalog ontologyCatalog;

  /**
   * Stores the listings in {@code body} under {@code ownerKey}. Listings whose source URL is
   * already in the catalog are skipped and counted.
   *
   * @throws com.ontologymarket.common.catalog.InvalidOntologyRequestException if the body is not a
   *     non-empty array of valid listings
   */
  public OntologyResponse add(String body, String ownerKey) {
    final List<NewOntology> ontologies = ontologyRequestReader.readNewOntologies(body);
    final OntologyAddResult result = ontologyCatalog.add(ontologies, ownerKey);

    final List<CreatedOntology> created =
        result.created().stream()
            .map(ontology -> new CreatedOntology(ontology.uuid(), ontology.name()))
            .toList();
    return OntologyResponse.ok(
        "Successfully added "
            + created.size()
            + " ontologies. Skipped "
            + result.skipped()
            + " ontologies that already existed.",
        Map.of("created_ontologies", created));
  }

  public record CreatedOntology(String uuid, String name) {}
}
