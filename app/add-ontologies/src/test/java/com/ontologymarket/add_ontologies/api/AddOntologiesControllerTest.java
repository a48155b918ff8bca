package com.ontologymarket.add_ontologies.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ontologymarket.add_ontologies.service.AddOntologiesService;
import com.ontologymarket.auth.AuthFixtures;
import com.ontologymarket.auth.service.SigningKeySource;
import com.ontologymarket.common.catalog.Ontology;
import com.ontologymarket.common.catalog.OntologyCatalog;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(AddOntologiesController.class)
@Import(AddOntologiesService.class)
@TestPropertySource(
    properties = {
      "FIREBASE_PROJECT_ID=" + AuthFixtures.PROJECT_ID,
      "marketplace.auth.bypass.enabled=true"
    })
class AddOntologiesControllerTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private OntologyCatalog ontologyCatalog;

  @MockitoBean private SigningKeySource signingKeySource;

  @BeforeEach
  void setUp() {
    when(signingKeySource.fetch()).thenReturn(AuthFixtures.testKeySet());
  }

  @Test
  void addsListingOwnedByDevEmailWhenBypassIsEnabled() throws Exception {
    mockMvc
        .perform(
            post("/add_ontologies")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Dev-Email", "dev@example.com")
                .content(listing("Pizza", "https://example.org/pizza.owl")))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.data.created_ontologies[0].name").value("Pizza"));

    assertThat(ontologyCatalog.search("Pizza", 10, 0).results())
        .extracting(Ontology::ownerEmail)
        .containsExactly("dev@example.com");
  }

  @Test
  void fallsBackToTokenWhenNoDevEmailIsAvailable() throws Exception {
    mockMvc
        .perform(
            post("/add_ontologies")
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.AUTHORIZATION, AuthFixtures.validBearer(Instant.now()))
                .content(listing("Wine", "https://example.org/wine.owl")))
        .andExpect(status().isOk());

    assertThat(ontologyCatalog.search("Wine", 10, 0).results())
        .extracting(Ontology::ownerEmail)
        .containsExactly("alice@example.com");
  }

  @Test
  void rejectsCallerWithNeitherDevEmailNorToken() throws Exception {
    mockMvc
        .perform(
            post("/add_ontologies")
                .contentType(MediaType.APPLICATION_JSON)
                .content(listing("Beer", "https://example.org/beer.owl")))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("missing-credential"));

    assertThat(ontologyCatalog.search("Beer", 10, 0).total()).isZero();
  }

  @Test
  void authenticatesBeforeParsingBody() throws Exception {
    mockMvc
        .perform(post("/add_ontologies").contentType(MediaType.APPLICATION_JSON).content("{oops"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void rejectsInvalidJsonFromAuthenticatedCaller() throws Exception {
    mockMvc
        .perform(
            post("/add_ontologies")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Dev-Email", "dev@example.com")
                .content("{oops"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("ADD_BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("Request body is not valid JSON"));
  }

  @Test
  void rejectsEmptyArray() throws Exception {
    mockMvc
        .perform(
            post("/add_ontologies")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Dev-Email", "dev@example.com")
                .content("[]"))
        .andExpect(status().isBadRequest())
        .andExpect(
            jsonPath("$.message").value("Request body must be a JSON array of ontology objects"));
  }

  @Test
  void rejectsMissingBody() throws Exception {
    mockMvc
        .perform(post("/add_ontologies").header("X-Dev-Email", "dev@example.com"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.message").value("No JSON data provided"));
  }

  @Test
  void answersPreflightForAnyOriginUnderWildcard() throws Exception {
    mockMvc
        .perform(
            options("/add_ontologies")
                .header(HttpHeaders.ORIGIN, "https://anywhere.example")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "POST"))
        .andExpect(status().isNoContent())
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, "*"));
  }

  @Test
  void rejectsGet() throws Exception {
    mockMvc.perform(get("/add_ontologies")).andExpect(status().isMethodNotAllowed());
  }

  private static String listing(String name, String sourceUrl) {
    return "[{\"name\":\"" + name + "\",\"source_url\":\"" + sourceUrl + "\"}]";
  }
}
