package io.github.scagogogo.central_search.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Facet block of a response.
 *
 * <p>Field facets arrive as flat lists alternating value and count, e.g. {@code ["org.apache", 30,
 * "com.google", 25]}; use {@link #valueCounts(String)} to read them as pairs. Missing sub-blocks
 * decode to empty maps.
 *
 * @param facetFields field name to alternating value/count list
 * @param facetQueries facet query to count
 * @param facetDates date facet name to its raw structure
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FacetCounts(
    @JsonProperty("facet_fields") Map<String, List<Object>> facetFields,
    @JsonProperty("facet_queries") Map<String, Integer> facetQueries,
    @JsonProperty("facet_dates") Map<String, JsonNode> facetDates) {

  public FacetCounts {
    facetFields = immutableCopy(facetFields);
    facetQueries = immutableCopy(facetQueries);
    facetDates = immutableCopy(facetDates);
  }

  /**
   * Pairs the alternating entries of a field facet.
   *
   * <p>A trailing value without a count is dropped, as is a pair whose count is not numeric.
   *
   * @param field facet field name
   * @return buckets in service order, or an empty list if the field was not faceted
   */
  public List<FacetValue> valueCounts(String field) {
    List<Object> entries = facetFields.get(field);
    List<FacetValue> result = new ArrayList<>();
    if (entries == null) {
      return result;
    }
    for (int i = 0; i + 1 < entries.size(); i += 2) {
      Object value = entries.get(i);
      if (entries.get(i + 1) instanceof Number count) {
        result.add(new FacetValue(String.valueOf(value), count.longValue()));
      }
    }
    return result;
  }

  private static <V> Map<String, V> immutableCopy(Map<String, V> map) {
    return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
  }
}
