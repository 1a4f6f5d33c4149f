package com.gu.contentapi.tagsearch.model;

import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/** One page of tag search results together with the paging metadata reported by the API. */
@Value
@Builder
public class TagSearchResult {

  @NonNull String status;
  int totalResults;
  int startIndex;
  int pageSize;
  int currentPage;
  int pages;

  @Singular List<Tag> results;
}
