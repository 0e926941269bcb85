package io.github.scagogogo.central_search.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One page of matching documents, in the order the service returned them.
 *
 * @param numFound total number of matches
 * @param start offset of the first document in this page
 * @param docs documents of this page
 * @param <D> document shape
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResponseBody<D extends SearchDocument>(
    @JsonProperty("numFound") long numFound,
    @JsonProperty("start") long start,
    @JsonProperty("docs") List<D> docs) {

  public ResponseBody {
    docs = docs == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(docs));
  }
}
