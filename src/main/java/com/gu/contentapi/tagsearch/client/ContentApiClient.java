package com.gu.contentapi.tagsearch.client;

import com.gu.contentapi.tagsearch.config.ContentApiConfig;
import com.gu.contentapi.tagsearch.exceptions.ContentApiException;
import com.gu.contentapi.tagsearch.exceptions.OtherContentApiException;
import com.gu.contentapi.tagsearch.model.TagSearchQuery;
import com.gu.contentapi.tagsearch.model.TagSearchResult;
import com.gu.contentapi.tagsearch.parsing.TagSearchResultDecoder;
import java.io.IOException;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.HttpEntity;
import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.util.EntityUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Client for the Content API tags endpoint.
 *
 * <p>Every call performs exactly one HTTP GET through the pooled client of the given {@link
 * ContentApiConfig}. Nothing is retried or cached, and the client keeps no state between calls, so
 * one instance can serve any number of threads and configurations.
 *
 * <p>Errors are reported in two distinct ways:
 *
 * <ul>
 *   <li>{@link ContentApiException} when the API answered but the answer is an error or cannot be
 *       decoded;
 *   <li>{@link IOException} when no usable HTTP response was obtained (connection refused,
 *       timeout, unknown host, malformed endpoint).
 * </ul>
 */
@Slf4j
@Component
@RequiredArgsConstructor(onConstructor_ = @Autowired)
public class ContentApiClient {

  private final ContentApiUrlBuilder urlBuilder;
  private final TagSearchResultDecoder decoder;

  public ContentApiClient() {
    this(new ContentApiUrlBuilder(), new TagSearchResultDecoder());
  }

  /**
   * Searches tags matching the query.
   *
   * @param query search term
   * @param config endpoint, key and HTTP client to use
   * @return the decoded first page of results
   * @throws com.gu.contentapi.tagsearch.exceptions.InvalidApiKeyException if the API reports
   *     the key as inactive
   * @throws OtherContentApiException for any other error status, or with status {@value
   *     OtherContentApiException#PARSE_ERROR_CODE} if the body cannot be decoded
   * @throws IOException on transport failures
   */
  public TagSearchResult tagSearch(TagSearchQuery query, ContentApiConfig config)
      throws ContentApiException, IOException {
    Objects.requireNonNull(query, "query must not be null");
    Objects.requireNonNull(config, "config must not be null");

    String url = urlBuilder.buildUrl(query, config);
    HttpGet httpGet = newGet(url);
    log.debug("Searching tags: {}", ContentApiUrlBuilder.maskApiKey(url));

    try (CloseableHttpResponse response = config.getHttpClient().execute(httpGet)) {
      int statusCode = response.getStatusLine().getStatusCode();
      HttpEntity entity = response.getEntity();

      if (!ContentApiErrors.isSuccess(statusCode)) {
        EntityUtils.consume(entity);
        ContentApiException error = ContentApiErrors.classify(response);
        log.warn(
            "Tag search for '{}' failed with HTTP {}: {}",
            query.q(),
            statusCode,
            error.getClass().getSimpleName());
        throw error;
      }

      byte[] body = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
      TagSearchResult result = decoder.decode(body).orElse(null);
      if (result == null) {
        log.warn(
            "Could not decode tag search response for '{}' ({} bytes)", query.q(), body.length);
        throw OtherContentApiException.parseError();
      }

      log.debug(
          "Tag search for '{}' returned {} of {} tags",
          query.q(),
          result.getResults().size(),
          result.getTotalResults());
      return result;
    }
  }

  private static HttpGet newGet(String url) throws IOException {
    HttpGet httpGet;
    try {
      httpGet = new HttpGet(url);
    } catch (IllegalArgumentException e) {
      throw new IOException("Invalid Content API URL: " + ContentApiUrlBuilder.maskApiKey(url), e);
    }
    httpGet.setHeader(HttpHeaders.ACCEPT, "application/json");
    return httpGet;
  }
}
