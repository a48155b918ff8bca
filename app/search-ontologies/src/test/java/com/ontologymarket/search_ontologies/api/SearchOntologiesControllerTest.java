package com.ontologymarket.search_ontologies.api;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ontologymarket.auth.AuthFixtures;
import com.ontologymarket.auth.service.SigningKeySource;
import com.ontologymarket.common.catalog.NewOntology;
import com.ontologymarket.common.catalog.OntologyCatalog;
import com.ontologymarket.search_ontologies.service.SearchOntologiesService;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpHeaders;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(SearchOntologiesController.class)
@Import(SearchOntologiesService.class)
@TestPropertySource(
    properties = {
      "FIREBASE_PROJECT_ID=" + AuthFixtures.PROJECT_ID,
      "marketplace.auth.cors.allowed-origins=https://app.example"
    })
class SearchOntologiesControllerTest {

  private static final String ALLOWED_ORIGIN = "https://app.example";

  @Autowired private MockMvc mockMvc;
  @Autowired private OntologyCatalog ontologyCatalog;

  @MockitoBean private SigningKeySource signingKeySource;

  @BeforeEach
  void setUp() {
    when(signingKeySource.fetch()).thenReturn(AuthFixtures.testKeySet());
    ontologyCatalog.add(
        List.of(
            new NewOntology(
                "Gene Ontology",
                "https://example.org/go.owl",
                null,
                "functions of genes",
                120,
                4.5,
                80,
                true)),
        "curator@example.com");
  }

  @Test
  void rejectsRequestWithoutCredential() throws Exception {
    mockMvc
        .perform(get("/search_ontologies"))
        .andExpect(status().isUnauthorized())
        .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, "Bearer"))
        .andExpect(jsonPath("$.code").value("UNAUTHORIZED"))
        .andExpect(jsonPath("$.message").value("missing-credential"));
  }

  @Test
  void rejectsExpiredToken() throws Exception {
    final Instant issuedAt = Instant.now().minus(Duration.ofHours(2));

    mockMvc
        .perform(
            get("/search_ontologies")
                .header(HttpHeaders.AUTHORIZATION, AuthFixtures.validBearer(issuedAt)))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("expired"));
  }

  @Test
  void dropsDevEmailHeaderWhenBypassIsDisabled() throws Exception {
    mockMvc
        .perform(get("/search_ontologies").header("X-Dev-Email", "dev@example.com"))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.message").value("missing-credential"));
  }

  @Test
  void searchesCatalogForVerifiedCaller() throws Exception {
    mockMvc
        .perform(
            get("/search_ontologies")
                .param("search_term", "Gene")
                .param("limit", "5")
                .header(HttpHeaders.AUTHORIZATION, AuthFixtures.validBearer(Instant.now()))
                .header(HttpHeaders.ORIGIN, ALLOWED_ORIGIN))
        .andExpect(status().isOk())
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, ALLOWED_ORIGIN))
        .andExpect(jsonPath("$.success").value(true))
        .andExpect(jsonPath("$.data.limit").value(5))
        .andExpect(jsonPath("$.data.results[0].name").value("Gene Ontology"))
        .andExpect(jsonPath("$.data.results[0].source_url").value("https://example.org/go.owl"));
  }

  @Test
  void searchIsCaseSensitive() throws Exception {
    mockMvc
        .perform(
            get("/search_ontologies")
                .param("search_term", "gene ontology")
                .header(HttpHeaders.AUTHORIZATION, AuthFixtures.validBearer(Instant.now())))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.count").value(0));
  }

  @Test
  void rejectsNonIntegerLimitAfterAuthentication() throws Exception {
    mockMvc
        .perform(
            get("/search_ontologies")
                .param("limit", "ten")
                .header(HttpHeaders.AUTHORIZATION, AuthFixtures.validBearer(Instant.now())))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("SEARCH_BAD_REQUEST"))
        .andExpect(jsonPath("$.message").value("limit must be an integer"));
  }

  @Test
  void unauthenticatedBadLimitStillGets401() throws Exception {
    mockMvc
        .perform(get("/search_ontologies").param("limit", "ten"))
        .andExpect(status().isUnauthorized());
  }

  @Test
  void answersPreflightWithoutCredential() throws Exception {
    mockMvc
        .perform(
            options("/search_ontologies")
                .header(HttpHeaders.ORIGIN, ALLOWED_ORIGIN)
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
        .andExpect(status().isNoContent())
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_ALLOW_ORIGIN, ALLOWED_ORIGIN))
        .andExpect(header().exists(HttpHeaders.ACCESS_CONTROL_ALLOW_METHODS))
        .andExpect(header().string(HttpHeaders.ACCESS_CONTROL_MAX_AGE, "3600"));
  }

  @Test
  void answersPlainOptionsWithNoContent() throws Exception {
    mockMvc.perform(options("/search_ontologies")).andExpect(status().isNoContent());
  }

  @Test
  void rejectsDisallowedOriginBeforeAuthentication() throws Exception {
    mockMvc
        .perform(
            get("/search_ontologies")
                .header(HttpHeaders.ORIGIN, "https://evil.example")
                .header(HttpHeaders.AUTHORIZATION, AuthFixtures.validBearer(Instant.now())))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("CORS_ORIGIN_REJECTED"));
  }

  @Test
  void rejectsDisallowedOriginPreflight() throws Exception {
    mockMvc
        .perform(
            options("/search_ontologies")
                .header(HttpHeaders.ORIGIN, "https://evil.example")
                .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
        .andExpect(status().isForbidden())
        .andExpect(jsonPath("$.code").value("CORS_ORIGIN_REJECTED"));
  }

  @Test
  void rejectsUnsupportedMethod() throws Exception {
    mockMvc
        .perform(post("/search_ontologies"))
        .andExpect(status().isMethodNotAllowed())
        .andExpect(jsonPath("$.code").value("METHOD_NOT_ALLOWED"));
  }
}
