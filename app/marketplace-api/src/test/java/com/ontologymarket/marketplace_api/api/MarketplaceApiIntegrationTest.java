/*
 * どこで: marketplace-api の結合テスト
 * 何を: モノリス構成に登録された全エンドポイントが匿名呼び出しを 401 で拒否することを検証する
 * なぜ: エンドポイント追加時に EndpointGuard を経由しない経路が紛れ込む回帰を防ぐため
 */
package com.ontologymarket.marketplace_api.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ontologymarket.auth.AuthFixtures;
import com.ontologymarket.auth.service.SigningKeySource;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.mvc.method.RequestMappingInfo;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

@SpringBootTest
@AutoConfigureMockMvc
@TestPropertySource(properties = "FIREBASE_PROJECT_ID=" + AuthFixtures.PROJECT_ID)
class MarketplaceApiIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private ObjectMapper objectMapper;

  @Autowired
  @Qualifier("requestMappingHandlerMapping")
  private RequestMappingHandlerMapping handlerMapping;

  @MockitoBean private SigningKeySource signingKeySource;

  @BeforeEach
  void setUp() {
    when(signingKeySource.fetch()).thenReturn(AuthFixtures.testKeySet());
  }

  @Test
  void everyMarketplaceEndpointRejectsAnonymousCaller() throws Exception {
    final List<String> checked = new ArrayList<>();
    for (Map.Entry<RequestMappingInfo, HandlerMethod> entry :
        handlerMapping.getHandlerMethods().entrySet()) {
      if (!entry.getValue().getBeanType().getPackageName().startsWith("com.ontologymarket")) {
        continue;
      }
      for (String path : entry.getKey().getPatternValues()) {
        for (RequestMethod method : entry.getKey().getMethodsCondition().getMethods()) {
          if (method == RequestMethod.OPTIONS) {
            continue;
          }
          mockMvc
              .perform(request(HttpMethod.valueOf(method.name()), path))
              .andExpect(status().isUnauthorized())
              .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
          checked.add(method + " " + path);
        }
      }
    }

    assertThat(checked)
        .containsExactlyInAnyOrder(
            "GET /search_ontologies",
            "POST /add_ontologies",
            "DELETE /delete_ontologies",
            "GET /tags",
            "POST /tags");
  }

  @Test
  void addSearchAndDeleteShareOneCatalog() throws Exception {
    final String bearer = AuthFixtures.validBearer(Instant.now());

    mockMvc
        .perform(
            post("/add_ontologies")
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .content(
                    "[{\"name\":\"Monolith Flow\","
                        + "\"source_url\":\"https://example.org/flow.owl\"}]"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.created_ontologies[0].name").value("Monolith Flow"));

    final String searchBody =
        mockMvc
            .perform(
                get("/search_ontologies")
                    .param("search_term", "Monolith Flow")
                    .header(HttpHeaders.AUTHORIZATION, bearer))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.count").value(1))
            .andExpect(jsonPath("$.data.results[0].owner_email").value("alice@example.com"))
            .andReturn()
            .getResponse()
            .getContentAsString();
    final JsonNode results = objectMapper.readTree(searchBody).path("data").path("results");
    final String uuid = results.get(0).path("uuid").asText();

    mockMvc
        .perform(
            delete("/delete_ontologies")
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.AUTHORIZATION, bearer)
                .content("[\"" + uuid + "\"]"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.data.deleted_count").value(1));
  }

  @Test
  void reportsBadRequestWithMarketplaceCode() throws Exception {
    mockMvc
        .perform(
            post("/tags")
                .contentType(MediaType.APPLICATION_JSON)
                .header(HttpHeaders.AUTHORIZATION, AuthFixtures.validBearer(Instant.now()))
                .content("\"not-an-array\""))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MARKETPLACE_BAD_REQUEST"));
  }

  @Test
  void healthEndpointIsOutsideTheAuthBoundary() throws Exception {
    mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
  }
}
