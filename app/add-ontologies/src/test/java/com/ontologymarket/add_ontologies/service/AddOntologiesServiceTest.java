package com.ontologymarket.add_ontologies.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ontologymarket.common.catalog.InMemoryOntologyCatalog;
import com.ontologymarket.common.catalog.InvalidOntologyRequestException;
import com.ontologymarket.common.catalog.Ontology;
import com.ontologymarket.common.catalog.OntologyPage;
import com.ontologymarket.common.catalog.OntologyRequestReader;
import com.ontologymarket.common.catalog.OntologyResponse;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AddOntologiesServiceTest {

  private static final String OWNER = "alice@example.com";

  private ValidatorFactory validatorFactory;
  private InMemoryOntologyCatalog catalog;
  private AddOntologiesService service;

  @BeforeEach
  void setUp() {
    validatorFactory = Validation.buildDefaultValidatorFactory();
    catalog =
        new InMemoryOntologyCatalog(
            Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC));
    service =
        new AddOntologiesService(
            new OntologyRequestReader(new ObjectMapper(), validatorFactory.getValidator()),
            catalog);
  }

  @AfterEach
  void tearDown() {
    validatorFactory.close();
  }

  @Test
  void addsListingsForOwner() {
    final OntologyResponse response =
        service.add(
            """
            [{"name":"Gene Ontology","source_url":"https://example.org/go.owl","is_public":true}]
            """,
            OWNER);

    assertThat(response.success()).isTrue();
    assertThat(response.message())
        .isEqualTo("Successfully added 1 ontologies. Skipped 0 ontologies that already existed.");
    final OntologyPage page = catalog.search(null, 10, 0);
    assertThat(page.results()).hasSize(1);
    final Ontology stored = page.results().get(0);
    assertThat(stored.ownerEmail()).isEqualTo(OWNER);
    assertThat(stored.isPublic()).isTrue();
    assertThat(response.data().get("created_ontologies"))
        .isEqualTo(
            List.of(new AddOntologiesService.CreatedOntology(stored.uuid(), "Gene Ontology")));
  }

  @Test
  void countsListingsWhoseSourceUrlAlreadyExists() {
    final String body =
        """
        [{"name":"Gene Ontology","source_url":"https://example.org/go.owl"},
         {"name":"Cell Ontology","source_url":"https://example.org/cl.owl"}]
        """;
    service.add(body, OWNER);

    final OntologyResponse response = service.add(body, "bob@example.com");

    assertThat(response.message())
        .isEqualTo("Successfully added 0 ontologies. Skipped 2 ontologies that already existed.");
    assertThat(catalog.search(null, 10, 0).total()).isEqualTo(2);
  }

  @Test
  void rejectsListingWithoutName() {
    assertThatThrownBy(
            () -> service.add("[{\"source_url\":\"https://example.org/go.owl\"}]", OWNER))
        .isInstanceOf(InvalidOntologyRequestException.class)
        .hasMessageStartingWith("ontology[0].name");
    assertThat(catalog.search(null, 10, 0).total()).isZero();
  }

  @Test
  void rejectsEmptyArray() {
    assertThatThrownBy(() -> service.add("[]", OWNER))
        .isInstanceOf(InvalidOntologyRequestException.class)
        .hasMessage("Request body must be a JSON array of ontology objects");
  }
}
