package com.ontologymarket.common.catalog;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentSkipListSet;

public class InMemoryTagCatalog implements TagCatalog {

  private final ConcurrentSkipListSet<String> tags = new ConcurrentSkipListSet<>();

  @Override
  public List<String> listTags() {
    return List.copyOf(tags);
  }

  @Override
  public List<String> addTags(List<String> newTags) {
    newTags.stream()
        .filter(Objects::nonNull)
        .map(tag -> tag.trim().toLowerCase(Locale.ROOT))
        .filter(tag -> !tag.isEmpty())
        .forEach(tags::add);
    return listTags();
  }
}
