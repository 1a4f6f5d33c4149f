package com.gu.contentapi.tagsearch.parsing;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.gu.contentapi.tagsearch.exceptions.ContentApiDecodingException;
import com.gu.contentapi.tagsearch.model.Reference;
import com.gu.contentapi.tagsearch.model.Section;
import com.gu.contentapi.tagsearch.model.Tag;
import com.gu.contentapi.tagsearch.model.TagSearchResult;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decodes the JSON body of a {@code /tags} response into a {@link TagSearchResult}.
 *
 * <p>Expected shape:
 *
 * <pre>
 * { "response": { "status": "ok", "total": 1, "startIndex": 1, "pageSize": 10,
 *                 "currentPage": 1, "pages": 1, "results": [ { tag }, ... ] } }
 * </pre>
 *
 * <p>Decoding is all or nothing: a missing or mistyped required field anywhere in the document
 * yields {@link Optional#empty()}, never a partial result. Optional fields that are absent or
 * {@code null} are left unset, but an optional field of the wrong type still fails the decode.
 * Unknown fields are ignored. Anything after the top-level JSON value makes the body malformed.
 */
@Slf4j
@Component
public class TagSearchResultDecoder {

  private final ObjectMapper objectMapper =
      JsonMapper.builder().enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).build();

  public Optional<TagSearchResult> decode(byte[] body) {
    if (body == null || body.length == 0) {
      log.debug("Empty response body, nothing to decode");
      return Optional.empty();
    }
    try {
      return Optional.of(toSearchResult(objectMapper.readTree(body)));
    } catch (IOException e) {
      log.debug("Response body is not valid JSON: {}", e.getMessage());
      return Optional.empty();
    } catch (ContentApiDecodingException e) {
      log.debug("Response body does not match the tag search schema: {}", e.getMessage());
      return Optional.empty();
    }
  }

  public Optional<TagSearchResult> decode(String body) {
    return decode(body == null ? null : body.getBytes(StandardCharsets.UTF_8));
  }

  private TagSearchResult toSearchResult(JsonNode root) {
    if (root == null || !root.isObject()) {
      throw new ContentApiDecodingException("Top-level JSON value is not an object");
    }
    JsonNode response = requiredObject(root, "response");

    TagSearchResult.TagSearchResultBuilder builder =
        TagSearchResult.builder()
            .status(requiredText(response, "status"))
            .totalResults(requiredInt(response, "total"))
            .startIndex(requiredInt(response, "startIndex"))
            .pageSize(requiredInt(response, "pageSize"))
            .currentPage(requiredInt(response, "currentPage"))
            .pages(requiredInt(response, "pages"));

    JsonNode results = requiredArray(response, "results");
    for (int i = 0; i < results.size(); i++) {
      JsonNode tagNode = results.get(i);
      if (!tagNode.isObject()) {
        throw new ContentApiDecodingException("results[" + i + "] is not an object");
      }
      builder.result(toTag(tagNode));
    }
    return builder.build();
  }

  private Tag toTag(JsonNode node) {
    return Tag.builder()
        .id(requiredText(node, "id"))
        .type(requiredText(node, "type"))
        .section(
            toSection(optionalText(node, "sectionId"), optionalText(node, "sectionName"))
                .orElse(null))
        .webTitle(requiredText(node, "webTitle"))
        .webUrl(requiredText(node, "webUrl"))
        .apiUrl(requiredText(node, "apiUrl"))
        .references(toReferences(node).orElse(null))
        .bio(optionalText(node, "bio").orElse(null))
        .bylineImageUrl(optionalText(node, "bylineImageUrl").orElse(null))
        .largeBylineImageUrl(optionalText(node, "bylineLargeImageUrl").orElse(null))
        .build();
  }

  /**
   * Combines the two section fields after parsing. A tag carrying only one of them has no
   * section; this is not treated as a schema error.
   */
  static Optional<Section> toSection(Optional<String> sectionId, Optional<String> sectionName) {
    if (sectionId.isPresent() && sectionName.isPresent()) {
      return Optional.of(new Section(sectionId.get(), sectionName.get()));
    }
    return Optional.empty();
  }

  private Optional<List<Reference>> toReferences(JsonNode tag) {
    JsonNode node = tag.get("references");
    if (node == null || node.isNull()) {
      return Optional.empty();
    }
    if (!node.isArray()) {
      throw new ContentApiDecodingException("Field 'references' is not an array");
    }
    List<Reference> references = new ArrayList<>(node.size());
    for (JsonNode ref : node) {
      if (!ref.isObject()) {
        throw new ContentApiDecodingException("Reference entry is not an object");
      }
      references.add(new Reference(requiredText(ref, "type"), requiredText(ref, "id")));
    }
    return Optional.of(references);
  }

  private static JsonNode requiredObject(JsonNode parent, String field) {
    JsonNode node = parent.get(field);
    if (node == null || !node.isObject()) {
      throw new ContentApiDecodingException("Missing or non-object field '" + field + "'");
    }
    return node;
  }

  private static JsonNode requiredArray(JsonNode parent, String field) {
    JsonNode node = parent.get(field);
    if (node == null || !node.isArray()) {
      throw new ContentApiDecodingException("Missing or non-array field '" + field + "'");
    }
    return node;
  }

  private static String requiredText(JsonNode parent, String field) {
    JsonNode node = parent.get(field);
    if (node == null || !node.isTextual()) {
      throw new ContentApiDecodingException("Missing or non-string field '" + field + "'");
    }
    return node.textValue();
  }

  private static int requiredInt(JsonNode parent, String field) {
    JsonNode node = parent.get(field);
    if (node == null || !node.isIntegralNumber() || !node.canConvertToInt()) {
      throw new ContentApiDecodingException("Missing or non-integer field '" + field + "'");
    }
    return node.intValue();
  }

  private static Optional<String> optionalText(JsonNode parent, String field) {
    JsonNode node = parent.get(field);
    if (node == null || node.isNull()) {
      return Optional.empty();
    }
    if (!node.isTextual()) {
      throw new ContentApiDecodingException("Field '" + field + "' is not a string");
    }
    return Optional.of(node.textValue());
  }
}
