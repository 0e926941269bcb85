package io.github.scagogogo.central_search.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;

/**
 * Response header: status, server-side query time and the echoed request parameters.
 *
 * @param status 0 on success
 * @param qTime query time in milliseconds ({@code QTime})
 * @param params echoed parameters; values are strings, or arrays for repeated keys
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResponseHeader(
    @JsonProperty("status") int status,
    @JsonProperty("QTime") int qTime,
    @JsonProperty("params") JsonNode params) {

  /**
   * Returns the echoed values of a request parameter.
   *
   * @param name parameter name, e.g. {@code q} or {@code facet.field}
   * @return the values in echo order, or an empty list if the parameter was not echoed
   */
  public List<String> paramValues(String name) {
    List<String> values = new ArrayList<>();
    if (params == null || !params.has(name)) {
      return values;
    }
    JsonNode value = params.get(name);
    if (value.isArray()) {
      value.forEach(element -> values.add(element.asText()));
    } else if (!value.isNull()) {
      values.add(value.asText());
    }
    return values;
  }
}
