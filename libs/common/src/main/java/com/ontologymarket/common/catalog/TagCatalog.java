package com.ontologymarket.common.catalog;

import java.util.List;

public interface TagCatalog {

  /** Returns every tag, lowercased, distinct and sorted. */
  List<String> listTags();

  /** Adds the given tags and returns the full tag list afterwards. */
  List<String> addTags(List<String> tags);
}
