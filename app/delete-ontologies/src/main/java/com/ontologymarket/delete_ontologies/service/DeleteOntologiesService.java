package com.ontologymarket.delete_ontologies.service;

import com.ontologymarket.common.catalog.OntologyCatalog;
import com.ontologymarket.common.catalog.OntologyRequestReader;
import com.ontologymarket.common.catalog.OntologyResponse;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class DeleteOntologiesService {

  private final OntologyRequestReader ontologyRequestReader;
  private final OntologyCatalog ontologyCatalog;

  /**
   * Deletes the listings named in {@code body} that {@code ownerKey} owns. Ids the caller does not
   * own are ignored; when nothing was deleted the response is unsuccessful but not an error.
   */
  public OntologyResponse delete(String body, String ownerKey) {
    final List<String> ontologyIds = ontologyRequestReader.readOntologyIds(body);
    final int deleted = ontologyCatalog.delete(ontologyIds, ownerKey);
    if (deleted == 0) {
      return OntologyResponse.failure(
          "No ontologies found with the provided IDs for the given user",
          Map.of("deleted_count", 0));
    }
    return OntologyResponse.ok(
        "Successfully deleted " + deleted + " ontologies", Map.of("deleted_count", deleted));
  }
}
