/*
 * どこで: delete-ontologies API
 * 何を: DELETE /delete_ontologies を公開し、EndpointGuard 経由で削除を実行する
 * なぜ: 削除対象の所有者判定に検証済みの呼び出し元だけを使うため
 */
package com.ontologymarket.delete_ontologies.api;

import com.ontologymarket.auth.web.EndpointGuard;
import com.ontologymarket.auth.web.EndpointPolicy;
import com.ontologymarket.delete_ontologies.service.DeleteOntologiesService;
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
public class DeleteOntologiesController {

  public static final EndpointPolicy POLICY =
      EndpointPolicy.of("delete_ontologies", HttpMethod.DELETE);

  private final EndpointGuard endpointGuard;
  private final DeleteOntologiesService deleteOntologiesService;

  @RequestMapping(
      path = "/delete_ontologies",
      method = {RequestMethod.DELETE, RequestMethod.OPTIONS})
  public ResponseEntity<?> deleteOntologies(
      @RequestBody(required = false) String body,
      HttpServletRequest request,
      HttpServletResponse response) {
    return endpointGuard.handle(
        request,
        response,
        POLICY,
        caller -> ResponseEntity.ok(deleteOntologiesService.delete(body, caller.ownerKey())));
  }
}
