/*
 * どこで: tags API
 * 何を: GET/POST /tags を公開し、EndpointGuard 経由で一覧取得と追加を実行する
 * なぜ: 同じパスで複数メソッドを受けても、認証と CORS 判定は一箇所で行うため
 */
package com.ontologymarket.tags.api;

import com.ontologymarket.auth.web.EndpointGuard;
import com.ontologymarket.auth.web.EndpointPolicy;
import com.ontologymarket.tags.service.TagsService;
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
public class TagsController {

  public static final EndpointPolicy POLICY =
      EndpointPolicy.of("tags", HttpMethod.GET, HttpMethod.POST);

  private final EndpointGuard endpointGuard;
  private final TagsService tagsService;

  @RequestMapping(
      path = "/tags",
      method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.OPTIONS})
  public ResponseEntity<?> tags(
      @RequestBody(required = false) String body,
      HttpServletRequest request,
      HttpServletResponse response) {
    return endpointGuard.handle(
        request,
        response,
        POLICY,
        caller ->
            ResponseEntity.ok(
                HttpMethod.POST.matches(request.getMethod())
                    ? tagsService.addTags(body)
                    : tagsService.listTags()));
  }
}
