package com.ontologymarket.tags.service;

import com.ontologymarket.common.catalog.OntologyRequestReader;
import com.ontologymarket.common.catalog.OntologyResponse;
import com.ontologymarket.common.catalog.TagCatalog;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TagsService {

  private static final Logger logger = LoggerFactory.getLogger(TagsService.class);

  private final OntologyRequestReader ontologyRequestReader;
  private final TagCatalog tagCatalog;

  public OntologyResponse listTags() {
    return OntologyResponse.ok(
        "Tags retrieved successfully", Map.of("tags", tagCatalog.listTags()));
  }

  /** Adds the tags in {@code body}, lowercased and trimmed, and returns every known tag. */
  public OntologyResponse addTags(String body) {
    final List<String> requested = ontologyRequestReader.readTags(body);
    final List<String> tags = tagCatalog.addTags(requested);
    logger.info("tags added requested={} total={}", requested.size(), tags.size());
    return OntologyResponse.ok("Tags added successfully", Map.of("tags", tags));
  }
}
