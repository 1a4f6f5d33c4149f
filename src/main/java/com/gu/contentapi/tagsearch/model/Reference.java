package com.gu.contentapi.tagsearch.model;

import java.util.Objects;

/**
 * Typed pointer from a tag to another resource, e.g. {@code isbn} or {@code musicbrainz}.
 *
 * @param type reference category
 * @param id identifier within that category
 */
public record Reference(String type, String id) {

  public Reference {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(id, "id must not be null");
  }
}
