package com.gu.contentapi.tagsearch.parsing;

import static org.junit.jupiter.api.Assertions.*;

import com.gu.contentapi.tagsearch.model.Reference;
import com.gu.contentapi.tagsearch.model.Section;
import com.gu.contentapi.tagsearch.model.Tag;
import com.gu.contentapi.tagsearch.model.TagSearchResult;
import com.gu.contentapi.tagsearch.util.JsonFileLoader;
import java.io.IOException;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TagSearchResultDecoderTest {

  private TagSearchResultDecoder decoder;

  @BeforeEach
  void setUp() {
    decoder = new TagSearchResultDecoder();
  }

  @Test
  void decode_sampleResponse_returnsEnvelopeAndTags() throws IOException {
    byte[] body = JsonFileLoader.loadBytesFromResources("json/tag-search-response.json");

    TagSearchResult result = decoder.decode(body).orElseThrow();

    assertEquals("ok", result.getStatus());
    assertEquals(2, result.getTotalResults());
    assertEquals(1, result.getStartIndex());
    assertEquals(10, result.getPageSize());
    assertEquals(1, result.getCurrentPage());
    assertEquals(1, result.getPages());
    assertEquals(2, result.getResults().size());

    Tag keyword = result.getResults().get(0);
    assertEquals("technology/video-games", keyword.getId());
    assertEquals("keyword", keyword.getType());
    assertEquals(Optional.of(new Section("technology", "Technology")), keyword.getSection());
    assertEquals(
        Optional.of(List.of(new Reference("wikipedia", "video-games"))), keyword.getReferences());
    assertTrue(keyword.getBio().isEmpty());

    Tag contributor = result.getResults().get(1);
    assertEquals("profile/jane-doe", contributor.getId());
    assertTrue(contributor.getSection().isEmpty());
    assertTrue(contributor.getReferences().isEmpty());
    assertEquals(Optional.of("<p>Jane Doe writes about video.</p>"), contributor.getBio());
    assertEquals(
        Optional.of("https://static.guim.co.uk/jane-doe.jpg"), contributor.getBylineImageUrl());
    assertEquals(
        Optional.of("https://static.guim.co.uk/jane-doe-large.png"),
        contributor.getLargeBylineImageUrl());
  }

  @Test
  void decode_tagMissingWebUrl_returnsEmpty() throws IOException {
    byte[] body = JsonFileLoader.loadBytesFromResources("json/tag-search-missing-web-url.json");

    assertTrue(decoder.decode(body).isEmpty());
  }

  @Test
  void decode_onlySectionIdPresent_sectionAbsent() {
    String json = envelope(tagJson("\"sectionId\": \"technology\""));

    Tag tag = decoder.decode(json).orElseThrow().getResults().get(0);

    assertTrue(tag.getSection().isEmpty());
  }

  @Test
  void decode_onlySectionNamePresent_sectionAbsent() {
    String json = envelope(tagJson("\"sectionName\": \"Technology\""));

    Tag tag = decoder.decode(json).orElseThrow().getResults().get(0);

    assertTrue(tag.getSection().isEmpty());
  }

  @Test
  void decode_nullOptionalFields_treatedAsAbsent() {
    String json = envelope(tagJson("\"bio\": null, \"references\": null, \"sectionId\": null"));

    Tag tag = decoder.decode(json).orElseThrow().getResults().get(0);

    assertTrue(tag.getBio().isEmpty());
    assertTrue(tag.getReferences().isEmpty());
    assertTrue(tag.getSection().isEmpty());
  }

  @Test
  void decode_optionalFieldOfWrongType_returnsEmpty() {
    assertTrue(decoder.decode(envelope(tagJson("\"bio\": 42"))).isEmpty());
    assertTrue(decoder.decode(envelope(tagJson("\"references\": {}"))).isEmpty());
  }

  @Test
  void decode_referenceWithoutType_returnsEmpty() {
    String json = envelope(tagJson("\"references\": [ { \"id\": \"video-games\" } ]"));

    assertTrue(decoder.decode(json).isEmpty());
  }

  @Test
  void decode_emptyResults_returnsEmptyTagList() {
    TagSearchResult result = decoder.decode(envelope("")).orElseThrow();

    assertTrue(result.getResults().isEmpty());
  }

  @Test
  void decode_nonIntegerTotal_returnsEmpty() {
    String json = envelope("").replace("\"total\": 1", "\"total\": \"1\"");

    assertTrue(decoder.decode(json).isEmpty());
  }

  @Test
  void decode_missingResponseObject_returnsEmpty() {
    assertTrue(decoder.decode("{\"status\": \"ok\"}").isEmpty());
    assertTrue(decoder.decode("[]").isEmpty());
  }

  @Test
  void decode_malformedJson_returnsEmpty() {
    assertTrue(decoder.decode("{\"response\": ").isEmpty());
    assertTrue(decoder.decode("<html>Gateway Timeout</html>").isEmpty());
    assertTrue(decoder.decode(new byte[0]).isEmpty());
  }

  @Test
  void decode_trailingContent_returnsEmpty() {
    assertTrue(decoder.decode(envelope("") + " <html>oops</html>").isEmpty());
    assertTrue(decoder.decode(envelope("") + envelope("")).isEmpty());
  }

  @Test
  void decode_unknownFieldsIgnored() {
    String json = envelope(tagJson("\"firstName\": \"Jane\", \"twitterHandle\": \"jd\""));

    assertTrue(decoder.decode(json).isPresent());
  }

  @Test
  void decode_encodedResult_reproducesEqualResult() throws IOException {
    TagSearchResult original =
        TagSearchResult.builder()
            .status("ok")
            .totalResults(120)
            .startIndex(11)
            .pageSize(10)
            .currentPage(2)
            .pages(12)
            .result(
                Tag.builder()
                    .id("music/music")
                    .type("keyword")
                    .section(new Section("music", "Music"))
                    .webTitle("Music")
                    .webUrl("https://www.theguardian.com/music/music")
                    .apiUrl("https://content.guardianapis.com/music/music")
                    .references(
                        List.of(
                            new Reference("musicbrainz", "a74b1b7f"),
                            new Reference("isbn", "9780141036144")))
                    .build())
            .result(
                Tag.builder()
                    .id("profile/john-smith")
                    .type("contributor")
                    .webTitle("John Smith")
                    .webUrl("https://www.theguardian.com/profile/john-smith")
                    .apiUrl("https://content.guardianapis.com/profile/john-smith")
                    .bio("Music critic")
                    .bylineImageUrl("https://static.guim.co.uk/john.jpg")
                    .largeBylineImageUrl("https://static.guim.co.uk/john-large.png")
                    .build())
            .build();

    String json = new TagSearchResultEncoder().encode(original);

    assertEquals(Optional.of(original), decoder.decode(json));
  }

  @Test
  void toSection_requiresBothParts() {
    assertEquals(
        Optional.of(new Section("uk", "UK news")),
        TagSearchResultDecoder.toSection(Optional.of("uk"), Optional.of("UK news")));
    assertTrue(TagSearchResultDecoder.toSection(Optional.of("uk"), Optional.empty()).isEmpty());
    assertTrue(TagSearchResultDecoder.toSection(Optional.empty(), Optional.empty()).isEmpty());
  }

  private static String tagJson(String extraFields) {
    String fields =
        """
        "id": "technology/games",
        "type": "keyword",
        "webTitle": "Games",
        "webUrl": "https://www.theguardian.com/technology/games",
        "apiUrl": "https://content.guardianapis.com/technology/games"
        """;
    return "{" + fields + (extraFields.isEmpty() ? "" : ", " + extraFields) + "}";
  }

  private static String envelope(String tags) {
    return """
        {
          "response": {
            "status": "ok",
            "total": 1,
            "startIndex": 1,
            "pageSize": 10,
            "currentPage": 1,
            "pages": 1,
            "results": [%s]
          }
        }
        """
        .formatted(tags);
  }
}
