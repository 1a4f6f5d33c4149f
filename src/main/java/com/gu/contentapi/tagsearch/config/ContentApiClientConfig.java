package com.gu.contentapi.tagsearch.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Exposes a single shared {@link ContentApiConfig}; its connection pool is closed on shutdown. */
@Slf4j
@Configuration
public class ContentApiClientConfig {

  @Bean(destroyMethod = "close")
  public ContentApiConfig contentApiConfig(ContentApiProperties properties) {
    log.info(
        "Configuring Content API client for {} (api key {})",
        properties.getEndpoint(),
        properties.isApiKeyConfigured() ? "configured" : "not configured");
    return ContentApiConfig.builder()
        .endpoint(properties.getEndpoint())
        .apiKey(properties.getApiKey())
        .connectTimeoutMs(properties.getConnectTimeoutMs())
        .socketTimeoutMs(properties.getSocketTimeoutMs())
        .maxConnections(properties.getMaxConnections())
        .maxConnectionsPerRoute(properties.getMaxConnectionsPerRoute())
        .build();
  }
}
