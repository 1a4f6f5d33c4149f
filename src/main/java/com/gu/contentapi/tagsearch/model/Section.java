package com.gu.contentapi.tagsearch.model;

import java.util.Objects;

/**
 * Content section a tag belongs to.
 *
 * <p>The API reports the id and the name as two independent fields on the tag. They are only
 * meaningful together, so a section exists only when both are present.
 */
public record Section(String id, String name) {

  public Section {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(name, "name must not be null");
  }
}
