package com.ontologymarket.search_ontologies;

import com.ontologymarket.auth.web.EndpointGuard;
import com.ontologymarket.common.LoggingConfigurationAssertions;
import org.junit.jupiter.api.Test;

class LoggingConfigurationTest {

  @Test
  void jsonLogsNameServiceAndKeepCallerMdc() throws Exception {
    LoggingConfigurationAssertions.assertMarketplaceJsonLogging(
        "search-ontologies", EndpointGuard.MDC_CALLER_SUBJECT, EndpointGuard.MDC_CALLER_SOURCE, "request_id");
  }
}
