package com.gu.contentapi.tagsearch.config;

import lombok.Getter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.PropertySource;
import org.springframework.stereotype.Component;

/**
 * Content API settings loaded from classpath:content-api.properties.
 *
 * <p>Any of these can be overridden the usual Spring way, e.g. {@code --content-api.key=...} on
 * the command line or {@code CONTENT_API_KEY} in the environment.
 */
@Getter
@Component
@PropertySource("classpath:content-api.properties")
public class ContentApiProperties {

  private final String endpoint;
  private final String apiKey;
  private final Integer connectTimeoutMs;
  private final Integer socketTimeoutMs;
  private final Integer maxConnections;
  private final Integer maxConnectionsPerRoute;

  public ContentApiProperties(
      @Value("${content-api.endpoint:" + ContentApiConfig.DEFAULT_ENDPOINT + "}") String endpoint,
      @Value("${content-api.key:}") String apiKey,
      @Value("${content-api.connect-timeout-ms:5000}") Integer connectTimeoutMs,
      @Value("${content-api.socket-timeout-ms:10000}") Integer socketTimeoutMs,
      @Value("${content-api.max-connections:20}") Integer maxConnections,
      @Value("${content-api.max-connections-per-route:10}") Integer maxConnectionsPerRoute) {
    this.endpoint = endpoint;
    this.apiKey = apiKey;
    this.connectTimeoutMs = connectTimeoutMs;
    this.socketTimeoutMs = socketTimeoutMs;
    this.maxConnections = maxConnections;
    this.maxConnectionsPerRoute = maxConnectionsPerRoute;
  }

  public boolean isApiKeyConfigured() {
    return apiKey != null && !apiKey.isBlank();
  }
}
