/*
 * どこで: libs/auth Web 層
 * 何を: 各エンドポイントが必ず通る唯一の入口 (メソッド判定 -> CORS -> 認証 -> 本処理)
 * なぜ: 関数単位の単独デプロイでもモノリスでも、検証を飛ばせるエンドポイントを作らないため
 */
package com.ontologymarket.auth.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ontologymarket.auth.model.CallerIdentity;
import com.ontologymarket.auth.model.InboundRequest;
import com.ontologymarket.auth.model.VerificationOutcome;
import com.ontologymarket.auth.service.AuthBoundary;
import com.ontologymarket.auth.service.AuthMetrics;
import com.ontologymarket.auth.service.CorsDecision;
import com.ontologymarket.auth.service.CorsPolicyGuard;
import com.ontologymarket.auth.service.SigningKeyUnavailableException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

/**
 * Single entry point every marketplace endpoint calls before doing any work.
 *
 * <p>Order of checks:
 *
 * <ol>
 *   <li>methods the endpoint does not serve get 405
 *   <li>a disallowed origin gets 403 before any authentication
 *   <li>{@code OPTIONS} gets 204 with CORS headers and no authentication
 *   <li>a rejected credential gets 401 carrying only the rejection code
 *   <li>otherwise the action runs with the caller identity
 * </ol>
 *
 * CORS headers are written straight onto the servlet response, so error responses produced later
 * by exception handlers carry them too.
 */
@RequiredArgsConstructor
public class EndpointGuard {

  public static final String MDC_CALLER_SUBJECT = "caller_subject";
  public static final String MDC_CALLER_SOURCE = "caller_source";

  private static final Logger logger = LoggerFactory.getLogger(EndpointGuard.class);

  private final CorsPolicyGuard corsPolicyGuard;
  private final AuthBoundary authBoundary;
  private final AuthMetrics metrics;
  private final ObjectMapper objectMapper;

  public ResponseEntity<?> handle(
      HttpServletRequest request,
      HttpServletResponse response,
      EndpointPolicy policy,
      Function<CallerIdentity, ResponseEntity<?>> action) {
    if (!policy.permits(request.getMethod())) {
      return ResponseEntity.status(HttpStatus.METHOD_NOT_ALLOWED)
          .header(HttpHeaders.ALLOW, policy.allowHeader())
          .body(new ApiErrorResponse("METHOD_NOT_ALLOWED", "method not allowed"));
    }

    final InboundRequest inbound = InboundRequest.from(request);
    final CorsDecision decision = corsPolicyGuard.evaluate(inbound.origin());
    if (decision instanceof CorsDecision.Rejected) {
      metrics.recordCorsRejected(policy.name());
      return corsRejected();
    }
    ((CorsDecision.Allowed) decision).applyTo(response);
    if (inbound.isOptions()) {
      return ResponseEntity.noContent().build();
    }

    final VerificationOutcome outcome;
    try {
      outcome = authBoundary.authenticate(inbound);
    } catch (SigningKeyUnavailableException ex) {
      logger.error("authentication unavailable endpoint={}", policy.name(), ex);
      metrics.recordUnavailable(policy.name());
      return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
          .body(
              new ApiErrorResponse(
                  "AUTH_UNAVAILABLE", "authentication is temporarily unavailable"));
    }

    if (outcome instanceof VerificationOutcome.Rejected rejected) {
      metrics.recordRejected(policy.name(), rejected.reason());
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
          .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
          .body(new ApiErrorResponse("UNAUTHORIZED", rejected.reason().code()));
    }

    final CallerIdentity identity = ((VerificationOutcome.Verified) outcome).identity();
    metrics.recordVerified(policy.name(), identity.source());
    request.setAttribute(CallerIdentity.REQUEST_ATTRIBUTE, identity);
    MDC.put(MDC_CALLER_SUBJECT, identity.subject());
    MDC.put(MDC_CALLER_SOURCE, identity.source().code());
    try {
      return action.apply(identity);
    } finally {
      MDC.remove(MDC_CALLER_SUBJECT);
      MDC.remove(MDC_CALLER_SOURCE);
    }
  }

  /**
   * Answers a browser preflight that the MVC layer intercepts before any controller runs.
   *
   * @return {@code false} if the origin was rejected
   */
  public boolean answerPreflight(
      String endpoint, HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    final CorsDecision decision = corsPolicyGuard.evaluate(request.getHeader(HttpHeaders.ORIGIN));
    if (decision instanceof CorsDecision.Allowed allowed) {
      allowed.applyTo(response);
      response.setStatus(HttpStatus.NO_CONTENT.value());
      return true;
    }
    metrics.recordCorsRejected(endpoint);
    response.setStatus(HttpStatus.FORBIDDEN.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), corsRejected().getBody());
    return false;
  }

  private ResponseEntity<ApiErrorResponse> corsRejected() {
    return ResponseEntity.status(HttpStatus.FORBIDDEN)
        .body(new ApiErrorResponse("CORS_ORIGIN_REJECTED", "origin is not allowed"));
  }
}
