/*
 * どこで: add-ontologies API
 * 何を: POST /add_ontologies を公開し、EndpointGuard 経由で登録を実行する
 * なぜ: 本文は文字列で受け取り、認証を通過した後にだけ JSON として解釈するため
 */
package com.ontologymarket.add_ontologies.api;

import com.ontologymarket.add_ontologies.service.AddOntologiesService;
import com.ontologymarket.auth.web.EndpointGuard;
import com.ontologymarket.auth.web.EndpointPolicy;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpMethod;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AddOntologiesController {

  public static final EndpointPolicy POLICY = EndpointPolicy.of("add_ontologies", HttpMethod.POST);

  private final EndpointGuard endpointGuard;
  private final AddOntologiesService addOntologiesService;

  @RequestMapping(
      path = "/add_ontologies",
      method = {RequestMethod.POST, RequestMethod.OPTIONS})
  public ResponseEntity<?> addOntologies(
      @RequestBody(required = false) String body,
      HttpServletRequest request,
      HttpServletResponse response) {
    return endpointGuard.handle(
        request,
        response,
        POLICY,
        caller -> ResponseEntity.ok(addOntologiesService.add(body, caller.ownerKey())));
  }
}
