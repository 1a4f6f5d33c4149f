package com.gu.contentapi.tagsearch;

import com.gu.contentapi.tagsearch.client.ContentApiClient;
import com.gu.contentapi.tagsearch.config.ContentApiConfig;
import com.gu.contentapi.tagsearch.model.Tag;
import com.gu.contentapi.tagsearch.model.TagSearchQuery;
import com.gu.contentapi.tagsearch.model.TagSearchResult;
import java.io.PrintStream;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Example invocation: searches tags for {@code content-api.example.query} and prints their ids.
 * Non-option arguments, when given, replace the configured query. Enabled with {@code
 * content-api.example.enabled=true}. Any error ends the application.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "content-api.example.enabled", havingValue = "true")
public class TagSearchExampleRunner implements ApplicationRunner {

  private final ContentApiClient contentApiClient;
  private final ContentApiConfig contentApiConfig;
  private final String query;
  private final PrintStream out;

  @Autowired
  public TagSearchExampleRunner(
      ContentApiClient contentApiClient,
      ContentApiConfig contentApiConfig,
      @Value("${content-api.example.query:video}") String query) {
    this(contentApiClient, contentApiConfig, query, System.out);
  }

  TagSearchExampleRunner(
      ContentApiClient contentApiClient,
      ContentApiConfig contentApiConfig,
      String query,
      PrintStream out) {
    this.contentApiClient = contentApiClient;
    this.contentApiConfig = contentApiConfig;
    this.query = query;
    this.out = out;
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    String term =
        args.getNonOptionArgs().isEmpty() ? query : String.join(" ", args.getNonOptionArgs());
    log.info("Running example tag search for '{}'", term);

    TagSearchResult result = contentApiClient.tagSearch(TagSearchQuery.of(term), contentApiConfig);
    out.println("Found tags:");
    for (Tag tag : result.getResults()) {
      out.println(tag.getId());
    }
  }
}
