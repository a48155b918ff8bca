package com.ontologymarket.common.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;

/**
 * Parses raw request bodies into catalog inputs.
 *
 * <p>Endpoints read bodies as text and hand them here only after the caller was authenticated, so
 * an unauthenticated caller never reaches JSON parsing.
 */
@RequiredArgsConstructor
public class OntologyRequestReader {

  private final ObjectMapper objectMapper;
  private final Validator validator;

  public List<NewOntology> readNewOntologies(String body) {
    final JsonNode array = readArray(body, "Request body must be a JSON array of ontology objects");
    final List<NewOntology> ontologies = new ArrayList<>(array.size());
    for (int i = 0; i < array.size(); i++) {
      final NewOntology ontology;
      try {
        ontology = objectMapper.treeToValue(array.get(i), NewOntology.class);
      } catch (JsonProcessingException | IllegalArgumentException ex) {
        throw new InvalidOntologyRequestException("ontology[" + i + "] is not a valid object", ex);
      }
      final Set<ConstraintViolation<NewOntology>> violations = validator.validate(ontology);
      if (!violations.isEmpty()) {
        final ConstraintViolation<NewOntology> first =
            violations.stream()
                .min(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .orElseThrow();
        throw new InvalidOntologyRequestException(
            "ontology[" + i + "]." + first.getPropertyPath() + " " + first.getMessage());
      }
      ontologies.add(ontology);
    }
    return ontologies;
  }

  public List<String> readOntologyIds(String body) {
    return readStrings(readArray(body, "Expected an array of ontology IDs"), "ontology ID");
  }

  /**
   * Reads a tag array leniently: blank and non-string entries are dropped, and an empty array
   * yields an empty list. Only a body that is not a JSON array is rejected.
   */
  public List<String> readTags(String body) {
    final JsonNode node = readJson(body);
    if (!node.isArray()) {
      throw new InvalidOntologyRequestException("Expected an array of tags");
    }
    final List<String> tags = new ArrayList<>(node.size());
    for (JsonNode element : node) {
      if (element.isTextual() && !element.asText().isBlank()) {
        tags.add(element.asText());
      }
    }
    return tags;
  }

  private JsonNode readArray(String body, String notArrayMessage) {
    final JsonNode node = readJson(body);
    if (!node.isArray() || node.isEmpty()) {
      throw new InvalidOntologyRequestException(notArrayMessage);
    }
    return node;
  }

  private JsonNode readJson(String body) {
    if (body == null || body.isBlank()) {
      throw new InvalidOntologyRequestException("No JSON data provided");
    }
    try {
      return objectMapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new InvalidOntologyRequestException("Request body is not valid JSON", ex);
    }
  }

  private List<String> readStrings(JsonNode array, String label) {
    final List<String> values = new ArrayList<>(array.size());
    for (JsonNode element : array) {
      if (!element.isTextual() || element.asText().isBlank()) {
        throw new InvalidOntologyRequestException("each " + label + " must be a non-blank string");
      }
      values.add(element.asText());
    }
    return values;
  }
}
