package io.github.scagogogo.central_search.response;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decoded search response, generic over the document shape.
 *
 * <p>Header and body are always present. The facet and highlighting blocks are only returned when
 * the request asked for them; an absent block is {@link Optional#empty()}, never an empty
 * placeholder. Instances are immutable.
 *
 * @param <D> document shape, e.g. {@link Artifact} or {@link Version}
 */
public final class ResponseEnvelope<D extends SearchDocument> {

  private final ResponseHeader responseHeader;
  private final ResponseBody<D> responseBody;
  private final FacetCounts facetCounts;
  private final Highlighting highlighting;

  public ResponseEnvelope(
      ResponseHeader responseHeader,
      ResponseBody<D> responseBody,
      FacetCounts facetCounts,
      Highlighting highlighting) {
    this.responseHeader = Objects.requireNonNull(responseHeader, "responseHeader must not be null");
    this.responseBody = Objects.requireNonNull(responseBody, "responseBody must not be null");
    this.facetCounts = facetCounts;
    this.highlighting = highlighting;
  }

  public ResponseHeader getResponseHeader() {
    return responseHeader;
  }

  public ResponseBody<D> getResponseBody() {
    return responseBody;
  }

  public Optional<FacetCounts> getFacetCounts() {
    return Optional.ofNullable(facetCounts);
  }

  public Optional<Highlighting> getHighlighting() {
    return Optional.ofNullable(highlighting);
  }

  /** Documents of this page, in service order. */
  public List<D> getDocs() {
    return responseBody.docs();
  }

  public long getNumFound() {
    return responseBody.numFound();
  }

  /**
   * Returns the highlighted fields of a document of this response.
   *
   * @return field name to fragments; empty if highlighting is absent or has no entry for the doc
   */
  public Map<String, List<String>> highlightsFor(D document) {
    return highlighting == null ? Map.of() : highlighting.forDocument(document);
  }

  @Override
  public String toString() {
    return "ResponseEnvelope{"
        + "status="
        + responseHeader.status()
        + ", numFound="
        + responseBody.numFound()
        + ", docs="
        + responseBody.docs().size()
        + ", facetCounts="
        + (facetCounts != null ? "present" : "absent")
        + ", highlighting="
        + (highlighting != null ? "present" : "absent")
        + '}';
  }
}
