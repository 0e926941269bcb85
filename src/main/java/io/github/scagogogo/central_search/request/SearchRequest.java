package io.github.scagogogo.central_search.request;

import static io.github.scagogogo.central_search.Constants.RESPONSE_FORMAT;

import io.github.scagogogo.central_search.util.QueryParamEncoder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import org.springframework.util.StringUtils;

/**
 * Mutable, chainable configuration of one call to the search endpoint.
 *
 * <p>{@link #toRequestParams()} renders the parameters in a fixed order:
 *
 * <ol>
 *   <li>{@code q}, {@code rows}, {@code wt=json}, {@code start}
 *   <li>{@code core}, if set
 *   <li>{@code sort=<field> <asc|desc>}, if a sort field is set
 *   <li>{@code facet=true} and one {@code facet.field} per field, if faceting is enabled
 *   <li>custom parameters, in map iteration order, with both key and value encoded
 * </ol>
 *
 * <p>Mutators never fail. Negative start or limit values are rendered as given; validating them is
 * left to the caller. The reserved parameters are always written by the renderer, so a custom
 * parameter named {@code q}, {@code rows}, {@code wt} or {@code start} appears a second time in the
 * rendered string.
 *
 * <p>Instances are not thread-safe.
 */
@Getter
public class SearchRequest {

  /** Largest page size the endpoint serves, also the default limit. */
  public static final int LIMIT_MAX = 200;

  private int start = 0;
  private int limit = LIMIT_MAX;
  private Query query = new Query();
  private String core;
  private String sortField;
  private boolean sortAscending;
  private boolean facetEnabled;
  private List<String> facetFields = new ArrayList<>();

  /** Opaque caller tag used to correlate batched requests; never rendered. */
  private String queryKey;

  private final Map<String, String> customParams = new HashMap<>();

  public SearchRequest setStart(int start) {
    this.start = start;
    return this;
  }

  public SearchRequest setLimit(int limit) {
    this.limit = limit;
    return this;
  }

  /** Sets the query; null resets it to an empty (match-all) query. */
  public SearchRequest setQuery(Query query) {
    this.query = query != null ? query : new Query();
    return this;
  }

  public SearchRequest setCore(String core) {
    this.core = core;
    return this;
  }

  /**
   * Sets the sort field and direction.
   *
   * @param field index field to sort on; null or empty disables sorting
   * @param ascending true for {@code asc}, false for {@code desc}
   */
  public SearchRequest setSort(String field, boolean ascending) {
    this.sortField = field;
    this.sortAscending = ascending;
    return this;
  }

  /** Changes the sort direction only. Has no visible effect while no sort field is set. */
  public SearchRequest setSortAscending(boolean ascending) {
    this.sortAscending = ascending;
    return this;
  }

  /**
   * Enables faceting on the given fields, replacing any previously configured fields. Calling it
   * with no fields only enables the facet toggle.
   */
  public SearchRequest enableFacet(String... fields) {
    this.facetEnabled = true;
    this.facetFields = fields == null ? new ArrayList<>() : new ArrayList<>(Arrays.asList(fields));
    return this;
  }

  public SearchRequest setQueryKey(String queryKey) {
    this.queryKey = queryKey;
    return this;
  }

  /** Adds a custom parameter; an existing value for the same key is replaced. */
  public SearchRequest addCustomParam(String key, String value) {
    customParams.put(key, value);
    return this;
  }

  public List<String> getFacetFields() {
    return Collections.unmodifiableList(facetFields);
  }

  public Map<String, String> getCustomParams() {
    return Collections.unmodifiableMap(customParams);
  }

  /**
   * Renders the encoded parameter string, without a leading {@code ?}.
   *
   * @return e.g. {@code q=*:*&rows=10&wt=json&start=0&core=gav}
   */
  public String toRequestParams() {
    StringBuilder params =
        new StringBuilder()
            .append("q=")
            .append(query.toRequestParamValue())
            .append("&rows=")
            .append(limit)
            .append("&wt=")
            .append(RESPONSE_FORMAT)
            .append("&start=")
            .append(start);

    if (StringUtils.hasLength(core)) {
      params.append("&core=").append(QueryParamEncoder.encode(core));
    }

    if (StringUtils.hasLength(sortField)) {
      String direction = sortAscending ? "asc" : "desc";
      params.append("&sort=").append(QueryParamEncoder.encode(sortField + " " + direction));
    }

    if (facetEnabled) {
      params.append("&facet=true");
      for (String field : facetFields) {
        params.append("&facet.field=").append(QueryParamEncoder.encode(field));
      }
    }

    for (Map.Entry<String, String> entry : customParams.entrySet()) {
      params
          .append('&')
          .append(QueryParamEncoder.encode(entry.getKey()))
          .append('=')
          .append(QueryParamEncoder.encode(entry.getValue()));
    }

    return params.toString();
  }

  @Override
  public String toString() {
    return "SearchRequest{"
        + "query="
        + query.render()
        + ", start="
        + start
        + ", limit="
        + limit
        + ", core="
        + core
        + ", sortField="
        + sortField
        + ", sortAscending="
        + sortAscending
        + ", facetFields="
        + (facetEnabled ? facetFields : "disabled")
        + ", queryKey="
        + queryKey
        + '}';
  }
}
