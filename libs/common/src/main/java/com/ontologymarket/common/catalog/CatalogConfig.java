package com.ontologymarket.common.catalog;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validator;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {

  @Bean
  @ConditionalOnMissingBean(OntologyCatalog.class)
  OntologyCatalog ontologyCatalog(Clock clock) {
    return new InMemoryOntologyCatalog(clock);
  }

  @Bean
  @ConditionalOnMissingBean(TagCatalog.class)
  TagCatalog tagCatalog() {
    return new InMemoryTagCatalog();
  }

  @Bean
  OntologyRequestReader ontologyRequestReader(ObjectMapper objectMapper, Validator validator) {
    return new OntologyRequestReader(objectMapper, validator);
  }
}
