package io.github.scagogogo.central_search.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.github.scagogogo.central_search.exceptions.DecodeException;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decodes the search endpoint's JSON envelope into a {@link ResponseEnvelope}.
 *
 * <p>The caller picks the document shape; the decoder never guesses it. {@code responseHeader} and
 * {@code response} are required. {@code facet_counts} and {@code highlighting} are optional and
 * decode to an absent block when missing or {@code null}.
 */
@Slf4j
@Component
public class ResponseDecoder {

  static final String HEADER_FIELD = "responseHeader";
  static final String BODY_FIELD = "response";
  static final String FACET_COUNTS_FIELD = "facet_counts";
  static final String HIGHLIGHTING_FIELD = "highlighting";

  private final ObjectMapper objectMapper;

  /** Rejects anything after the top-level value, e.g. a truncated HTML error page. */
  private final ObjectReader treeReader;

  public ResponseDecoder() {
    this(new ObjectMapper());
  }

  public ResponseDecoder(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    this.treeReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
  }

  /**
   * Decodes a raw response.
   *
   * @param rawJson response payload
   * @param docType document shape to decode {@code response.docs} into
   * @return the decoded envelope
   * @throws DecodeException if the payload is blank, not a JSON object, or lacks header or body
   */
  public <D extends SearchDocument> ResponseEnvelope<D> decode(String rawJson, Class<D> docType) {
    Objects.requireNonNull(docType, "docType must not be null");
    if (rawJson == null || rawJson.isBlank()) {
      throw new DecodeException("Response payload is empty");
    }

    JsonNode root;
    try {
      root = treeReader.readTree(rawJson);
    } catch (JsonProcessingException e) {
      throw new DecodeException("Response payload is not valid JSON: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new DecodeException("Response payload is not a JSON object");
    }

    JsonNode headerNode = requireObject(root, HEADER_FIELD);
    JsonNode bodyNode = requireObject(root, BODY_FIELD);

    try {
      ResponseHeader header = objectMapper.treeToValue(headerNode, ResponseHeader.class);
      JavaType bodyType =
          objectMapper.getTypeFactory().constructParametricType(ResponseBody.class, docType);
      ResponseBody<D> body = objectMapper.treeToValue(bodyNode, bodyType);

      FacetCounts facetCounts = null;
      JsonNode facetNode = root.get(FACET_COUNTS_FIELD);
      if (isPresent(facetNode)) {
        facetCounts = objectMapper.treeToValue(facetNode, FacetCounts.class);
      }

      Highlighting highlighting = null;
      JsonNode highlightingNode = root.get(HIGHLIGHTING_FIELD);
      if (isPresent(highlightingNode)) {
        highlighting = objectMapper.treeToValue(highlightingNode, Highlighting.class);
      }

      log.debug(
          "Decoded {} response: status={}, numFound={}, docs={}, facets={}, highlighting={}",
          docType.getSimpleName(),
          header.status(),
          body.numFound(),
          body.docs().size(),
          facetCounts != null,
          highlighting != null);
      return new ResponseEnvelope<>(header, body, facetCounts, highlighting);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      throw new DecodeException(
          "Failed to decode " + docType.getSimpleName() + " response: " + e.getMessage(), e);
    }
  }

  private static JsonNode requireObject(JsonNode root, String field) {
    JsonNode node = root.get(field);
    if (!isPresent(node)) {
      throw new DecodeException("Response payload has no '" + field + "' block");
    }
    if (!node.isObject()) {
      throw new DecodeException("Response block '" + field + "' is not a JSON object");
    }
    return node;
  }

  private static boolean isPresent(JsonNode node) {
    return node != null && !node.isNull() && !node.isMissingNode();
  }
}
