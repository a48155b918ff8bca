/*
 * どこで: search-ontologies API
 * 何を: GET /search_ontologies を公開し、EndpointGuard 経由で検索を実行する
 * なぜ: 認証前にクエリ解釈や検索が走らないようにするため
 */
package com.ontologymarket.search_ontologies.api;

import com.ontologymarket.auth.web.EndpointGuard;
import com.ontologymarket.auth.web.EndpointPolicy;
import com.ontologymarket.search_ontologies.service.SearchOntologiesService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class SearchOntologiesController {

  public static final EndpointPolicy POLICY =
      EndpointPolicy.of("search_ontologies", HttpMethod.GET);

  private final EndpointGuard endpointGuard;
  private final SearchOntologiesService searchOntologiesService;

  @RequestMapping(
      path = "/search_ontologies",
      method = {RequestMethod.GET, RequestMethod.OPTIONS})
  public ResponseEntity<?> searchOntologies(
      @RequestParam(name = "search_term", required = false) String searchTerm,
      @RequestParam(name = "limit", required = false) String limit,
      @RequestParam(name = "offset", required = false) String offset,
      HttpServletRequest request,
      HttpServletResponse response) {
    return endpointGuard.handle(
        request,
        response,
        POLICY,
        caller -> ResponseEntity.ok(searchOntologiesService.search(searchTerm, limit, offset)));
  }
}
