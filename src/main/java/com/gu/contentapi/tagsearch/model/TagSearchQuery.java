package com.gu.contentapi.tagsearch.model;

/** Free-text search against the tags endpoint. */
public record TagSearchQuery(String q) {

  public TagSearchQuery {
    if (q == null || q.isBlank()) {
      throw new IllegalArgumentException("Search term must not be blank");
    }
  }

  public static TagSearchQuery of(String q) {
    return new TagSearchQuery(q);
  }
}
