package com.gu.contentapi.tagsearch.model;

import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A taggable entity (keyword, contributor, series, ...) returned by the tags endpoint.
 *
 * <p>{@code id}, {@code type}, {@code webTitle}, {@code webUrl} and {@code apiUrl} are always
 * present. Everything else is optional and exposed as {@link Optional}.
 */
@Value
@Builder
public class Tag {

  @NonNull String id;
  @NonNull String type;
  Section section;
  @NonNull String webTitle;
  @NonNull String webUrl;
  @NonNull String apiUrl;
  List<Reference> references;
  String bio;
  String bylineImageUrl;
  String largeBylineImageUrl;

  public Optional<Section> getSection() {
    return Optional.ofNullable(section);
  }

  public Optional<List<Reference>> getReferences() {
    return Optional.ofNullable(references).map(List::copyOf);
  }

  public Optional<String> getBio() {
    return Optional.ofNullable(bio);
  }

  public Optional<String> getBylineImageUrl() {
    return Optional.ofNullable(bylineImageUrl);
  }

  /** Mapped from the {@code bylineLargeImageUrl} field of the response. */
  public Optional<String> getLargeBylineImageUrl() {
    return Optional.ofNullable(largeBylineImageUrl);
  }
}
