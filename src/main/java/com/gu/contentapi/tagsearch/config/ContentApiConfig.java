package com.gu.contentapi.tagsearch.config;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;

/**
 * Everything a call against the Content API needs: the endpoint base, an optional API key and a
 * pooled HTTP client.
 *
 * <p>The HTTP client is created once per configuration and shared by every request made with it,
 * from any number of threads. It is released by {@link #close()}; a configuration must not be used
 * after it has been closed.
 */
@Slf4j
public class ContentApiConfig implements Closeable {

  public static final String DEFAULT_ENDPOINT = "http://content.guardianapis.com";

  public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5000;
  public static final int DEFAULT_SOCKET_TIMEOUT_MS = 10000;
  public static final int DEFAULT_MAX_CONNECTIONS = 20;
  public static final int DEFAULT_MAX_CONNECTIONS_PER_ROUTE = 10;

  @Getter private final String endpoint;
  private final String apiKey;
  @Getter private final CloseableHttpClient httpClient;

  @Builder
  private ContentApiConfig(
      String endpoint,
      String apiKey,
      Integer connectTimeoutMs,
      Integer socketTimeoutMs,
      Integer maxConnections,
      Integer maxConnectionsPerRoute) {
    this(
        endpoint,
        apiKey,
        createHttpClient(
            valueOrDefault(connectTimeoutMs, DEFAULT_CONNECT_TIMEOUT_MS),
            valueOrDefault(socketTimeoutMs, DEFAULT_SOCKET_TIMEOUT_MS),
            valueOrDefault(maxConnections, DEFAULT_MAX_CONNECTIONS),
            valueOrDefault(maxConnectionsPerRoute, DEFAULT_MAX_CONNECTIONS_PER_ROUTE)));
  }

  private ContentApiConfig(String endpoint, String apiKey, CloseableHttpClient httpClient) {
    this.endpoint = endpoint == null || endpoint.isBlank() ? DEFAULT_ENDPOINT : endpoint.trim();
    this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
  }

  /**
   * Configuration bound to the public endpoint with a freshly allocated connection pool.
   *
   * @param apiKey key appended to every request, if present
   */
  public static ContentApiConfig defaultConfig(Optional<String> apiKey) {
    Objects.requireNonNull(apiKey, "apiKey must not be null, use Optional.empty()");
    return ContentApiConfig.builder().apiKey(apiKey.orElse(null)).build();
  }

  /**
   * Configuration around an HTTP client created by the caller. Ownership passes to the returned
   * configuration: {@link #close()} closes the client.
   */
  public static ContentApiConfig withHttpClient(
      String endpoint, String apiKey, CloseableHttpClient httpClient) {
    return new ContentApiConfig(endpoint, apiKey, httpClient);
  }

  public Optional<String> getApiKey() {
    return Optional.ofNullable(apiKey);
  }

  @Override
  public void close() throws IOException {
    httpClient.close();
    log.info("Content API HTTP client for {} closed", endpoint);
  }

  private static CloseableHttpClient createHttpClient(
      int connectTimeoutMs, int socketTimeoutMs, int maxConnections, int maxConnectionsPerRoute) {
    PoolingHttpClientConnectionManager connectionManager = new PoolingHttpClientConnectionManager();
    connectionManager.setMaxTotal(maxConnections);
    connectionManager.setDefaultMaxPerRoute(maxConnectionsPerRoute);

    RequestConfig requestConfig =
        RequestConfig.custom()
            .setConnectTimeout(connectTimeoutMs)
            .setConnectionRequestTimeout(connectTimeoutMs)
            .setSocketTimeout(socketTimeoutMs)
            .build();

    return HttpClients.custom()
        .setConnectionManager(connectionManager)
        .setDefaultRequestConfig(requestConfig)
        .disableAutomaticRetries()
        .build();
  }

  private static int valueOrDefault(Integer value, int defaultValue) {
    return value == null || value <= 0 ? defaultValue : value;
  }
}
