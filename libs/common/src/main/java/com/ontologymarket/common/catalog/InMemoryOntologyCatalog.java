package com.ontologymarket.common.catalog;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local catalog used for local runs and tests.
 *
 * <p>Each standalone function owns its own instance, so listings are not shared across
 * deployments.
 */
public class InMemoryOntologyCatalog implements OntologyCatalog {

  private static final Logger logger = LoggerFactory.getLogger(InMemoryOntologyCatalog.class);
  private static final Comparator<Ontology> NEWEST_FIRST =
      Comparator.comparing(Ontology::createdAt).reversed().thenComparing(Ontology::uuid);

  private final Clock clock;
  private final Map<String, Ontology> ontologies = new ConcurrentHashMap<>();

  public InMemoryOntologyCatalog(Clock clock) {
    this.clock = clock;
  }

  @Override
  public OntologyPage search(String searchTerm, int limit, int offset) {
    final List<Ontology> matches =
        ontologies.values().stream()
            .filter(ontology -> matches(ontology, searchTerm))
            .sorted(NEWEST_FIRST)
            .toList();
    final List<Ontology> page = matches.stream().skip(offset).limit(limit).toList();
    return new OntologyPage(page, matches.size(), offset, limit);
  }

  @Override
  public synchronized OntologyAddResult add(List<NewOntology> newOntologies, String ownerEmail) {
    final Instant createdAt = Instant.now(clock);
    final Set<String> knownSourceUrls = new HashSet<>();
    ontologies.values().forEach(ontology -> knownSourceUrls.add(ontology.sourceUrl()));

    final List<Ontology> created = new ArrayList<>();
    int skipped = 0;
    for (NewOntology candidate : newOntologies) {
      if (!knownSourceUrls.add(candidate.sourceUrl())) {
        skipped++;
        continue;
      }
      final Ontology ontology =
          Ontology.create(UUID.randomUUID().toString(), candidate, ownerEmail, createdAt);
      ontologies.put(ontology.uuid(), ontology);
      created.add(ontology);
    }
    logger.info(
        "ontologies added owner={} created={} skipped={}", ownerEmail, created.size(), skipped);
    return new OntologyAddResult(created, skipped);
  }

  @Override
  public synchronized int delete(List<String> ontologyIds, String ownerEmail) {
    int deleted = 0;
    for (String ontologyId : ontologyIds) {
      final Ontology existing = ontologies.get(ontologyId);
      if (existing != null && existing.ownerEmail().equals(ownerEmail)) {
        ontologies.remove(ontologyId);
        deleted++;
      }
    }
    logger.info(
        "ontologies deleted owner={} requested={} deleted={}",
        ownerEmail,
        ontologyIds.size(),
        deleted);
    return deleted;
  }

  private boolean matches(Ontology ontology, String searchTerm) {
    if (searchTerm == null || searchTerm.isBlank()) {
      return true;
    }
    return contains(ontology.name(), searchTerm) || contains(ontology.description(), searchTerm);
  }

  private boolean contains(String value, String needle) {
    // 大文字小文字は区別する
    return value != null && value.contains(needle);
  }
}
