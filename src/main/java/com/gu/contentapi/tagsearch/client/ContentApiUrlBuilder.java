package com.gu.contentapi.tagsearch.client;

import com.gu.contentapi.tagsearch.config.ContentApiConfig;
import com.gu.contentapi.tagsearch.model.TagSearchQuery;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.springframework.stereotype.Component;

/** Builds request URLs for the tags endpoint. */
@Component
public class ContentApiUrlBuilder {

  public static final String TAGS_PATH = "tags";
  public static final String QUERY_PARAM = "q";
  public static final String API_KEY_PARAM = "api-key";

  /**
   * Builds {@code {endpoint}/tags?q={term}[&api-key={key}]}.
   *
   * <p>The endpoint is used as configured; a malformed one is reported when the request is sent.
   */
  public String buildUrl(TagSearchQuery query, ContentApiConfig config) {
    Objects.requireNonNull(query, "query must not be null");
    Objects.requireNonNull(config, "config must not be null");

    StringBuilder url =
        new StringBuilder(normalizeBase(config.getEndpoint()))
            .append('/')
            .append(TAGS_PATH)
            .append('?')
            .append(QUERY_PARAM)
            .append('=')
            .append(encode(query.q()));

    config
        .getApiKey()
        .ifPresent(key -> url.append('&').append(API_KEY_PARAM).append('=').append(encode(key)));
    return url.toString();
  }

  /** Same URL with the API key value replaced, for logging. */
  static String maskApiKey(String url) {
    return url.replaceAll("([?&]" + API_KEY_PARAM + "=)[^&]*", "$1****");
  }

  private static String normalizeBase(String endpoint) {
    return endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
