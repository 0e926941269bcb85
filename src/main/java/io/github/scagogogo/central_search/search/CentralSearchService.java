package io.github.scagogogo.central_search.search;

import static io.github.scagogogo.central_search.Constants.CLASS_HIGHLIGHT_FIELD;
import static io.github.scagogogo.central_search.Constants.GAV_CORE;

import io.github.scagogogo.central_search.client.SearchTransport;
import io.github.scagogogo.central_search.exceptions.DecodeException;
import io.github.scagogogo.central_search.exceptions.TransportException;
import io.github.scagogogo.central_search.request.AdvancedSearchOptions;
import io.github.scagogogo.central_search.request.Query;
import io.github.scagogogo.central_search.request.SearchRequest;
import io.github.scagogogo.central_search.response.Artifact;
import io.github.scagogogo.central_search.response.ResponseDecoder;
import io.github.scagogogo.central_search.response.ResponseEnvelope;
import io.github.scagogogo.central_search.response.SearchDocument;
import io.github.scagogogo.central_search.response.Version;
import java.util.List;
import java.util.Objects;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs search requests end to end: renders the request, hands it to the {@link SearchTransport}
 * and decodes the payload into the requested document shape.
 *
 * <p>Transport and decode failures propagate unchanged; nothing is retried here.
 */
@Slf4j
@Service
public class CentralSearchService {

  private static final int CLASS_HIGHLIGHT_SNIPPETS = 3;

  private final SearchTransport transport;
  private final ResponseDecoder decoder;

  public CentralSearchService(SearchTransport transport, ResponseDecoder decoder) {
    this.transport = Objects.requireNonNull(transport, "transport must not be null");
    this.decoder = Objects.requireNonNull(decoder, "decoder must not be null");
  }

  /**
   * Executes a request and decodes the response.
   *
   * @param request the request to render
   * @param docType document shape expected in the response
   * @return the decoded response
   * @throws TransportException if the call fails
   * @throws DecodeException if the payload cannot be decoded
   */
  public <D extends SearchDocument> ResponseEnvelope<D> search(
      SearchRequest request, Class<D> docType) {
    Objects.requireNonNull(request, "request must not be null");
    String params = request.toRequestParams();
    if (request.getQueryKey() != null) {
      log.debug("Executing search [{}]: {}", request.getQueryKey(), params);
    } else {
      log.debug("Executing search: {}", params);
    }

    String payload = transport.fetch(params);
    ResponseEnvelope<D> envelope = decoder.decode(payload, docType);

    log.debug(
        "Search{} returned {} of {} documents",
        request.getQueryKey() != null ? " [" + request.getQueryKey() + "]" : "",
        envelope.getDocs().size(),
        envelope.getNumFound());
    return envelope;
  }

  /** Executes a request against artifact-level documents. */
  public ResponseEnvelope<Artifact> searchArtifacts(SearchRequest request) {
    return search(request, Artifact.class);
  }

  /** Executes a request against version-level documents. */
  public ResponseEnvelope<Version> searchVersions(SearchRequest request) {
    return search(request, Version.class);
  }

  /**
   * Lists the artifacts of a group.
   *
   * @param groupId exact groupId
   * @param limit page size; the default is kept when not positive
   * @return matching artifacts in service order
   */
  public List<Artifact> searchByGroupId(String groupId, int limit) {
    return searchArtifacts(pagedRequest(new Query().setGroupId(groupId), limit)).getDocs();
  }

  /** Lists artifacts with the given artifactId across all groups. */
  public List<Artifact> searchByArtifactId(String artifactId, int limit) {
    return searchArtifacts(pagedRequest(new Query().setArtifactId(artifactId), limit)).getDocs();
  }

  /** Lists artifacts carrying a tag. */
  public List<Artifact> searchByTag(String tag, int limit) {
    return searchArtifacts(pagedRequest(new Query().setTags(tag), limit)).getDocs();
  }

  /**
   * Finds the versions whose published file has the given SHA-1 checksum.
   *
   * @param sha1 40 hex characters
   * @param limit page size; the default is kept when not positive
   * @return matching versions, usually one
   */
  public List<Version> searchBySha1(String sha1, int limit) {
    return searchVersions(pagedRequest(new Query().setSha1(sha1), limit)).getDocs();
  }

  /** Finds versions containing a class with the given simple name. */
  public List<Version> searchByClassName(String className, int limit) {
    return searchVersions(pagedRequest(new Query().setClassName(className), limit)).getDocs();
  }

  /**
   * Lists the published versions of one artifact from the {@code gav} core.
   *
   * @param groupId exact groupId
   * @param artifactId exact artifactId
   * @param limit page size; the default is kept when not positive
   * @return versions in service order
   */
  public List<Version> listVersions(String groupId, String artifactId, int limit) {
    Query query = new Query().setGroupId(groupId).setArtifactId(artifactId);
    return searchVersions(pagedRequest(query, limit).setCore(GAV_CORE)).getDocs();
  }

  /**
   * Runs a raw query against the {@code gav} core with explicit ordering.
   *
   * @param query query-language clause, e.g. {@code g:org.springframework}
   * @param sortField index field to sort on, e.g. {@code timestamp}
   * @param ascending sort direction
   * @param limit page size; the default is kept when not positive
   * @return versions in the requested order
   */
  public List<Version> searchGavsWithSort(
      String query, String sortField, boolean ascending, int limit) {
    SearchRequest request =
        pagedRequest(new Query().setCustomQuery(query), limit)
            .setCore(GAV_CORE)
            .setSort(sortField, ascending);
    return searchVersions(request).getDocs();
  }

  /**
   * Searches artifacts and counts the matches per value of each facet field.
   *
   * @param query query-language clause; empty matches everything
   * @param facetFields fields to facet on, e.g. {@code g} or {@code p}
   * @param limit page size; the default is kept when not positive
   * @return the decoded response; facet buckets are read through {@link
   *     io.github.scagogogo.central_search.response.FacetCounts#valueCounts(String)}
   */
  public ResponseEnvelope<Artifact> searchArtifactsWithFacets(
      String query, List<String> facetFields, int limit) {
    Objects.requireNonNull(facetFields, "facetFields must not be null");
    SearchRequest request =
        pagedRequest(new Query().setCustomQuery(query), limit)
            .enableFacet(facetFields.toArray(new String[0]));
    return searchArtifacts(request);
  }

  /**
   * Searches artifacts by any combination of coordinates.
   *
   * @param options coordinates to match
   * @param limit page size; the default is kept when not positive
   * @return matching artifacts in service order
   */
  public List<Artifact> advancedSearch(AdvancedSearchOptions options, int limit) {
    Objects.requireNonNull(options, "options must not be null");
    return searchArtifacts(pagedRequest(options.toQuery(), limit)).getDocs();
  }

  /**
   * Searches artifacts that declare a dependency on the given coordinates.
   *
   * @param groupId dependency groupId, may be empty
   * @param artifactId dependency artifactId, may be empty
   * @param limit page size; the default is kept when not positive
   * @return matching artifacts in service order
   * @throws IllegalArgumentException if both groupId and artifactId are empty
   */
  public List<Artifact> searchByDependency(String groupId, String artifactId, int limit) {
    String clause = AdvancedSearchOptions.makeDependencyQuery(groupId, artifactId);
    if (clause.isEmpty()) {
      throw new IllegalArgumentException("groupId or artifactId must be provided");
    }
    return searchArtifacts(pagedRequest(new Query().setCustomQuery(clause), limit)).getDocs();
  }

  /**
   * Searches artifacts published under a license.
   *
   * @param license license name as indexed, e.g. {@code apache}
   * @param limit page size; the default is kept when not positive
   * @return matching artifacts in service order
   */
  public List<Artifact> searchByLicense(String license, int limit) {
    Query query = new Query().setCustomQuery(AdvancedSearchOptions.makeLicenseQuery(license));
    return searchArtifacts(pagedRequest(query, limit)).getDocs();
  }

  /**
   * Searches versions containing a class, with the matching class names highlighted in the
   * {@code fch} field.
   *
   * @param fullyQualifiedClassName class name, may contain wildcards
   * @param limit page size; the default is kept when not positive
   * @return the decoded response, including its highlighting block
   */
  public ResponseEnvelope<Version> searchClassesWithHighlighting(
      String fullyQualifiedClassName, int limit) {
    Query query = new Query().setFullyQualifiedClassName(fullyQualifiedClassName);
    SearchRequest request =
        pagedRequest(query, limit)
            .addCustomParam("hl", "true")
            .addCustomParam("hl.fl", CLASS_HIGHLIGHT_FIELD)
            .addCustomParam("hl.snippets", String.valueOf(CLASS_HIGHLIGHT_SNIPPETS));
    return searchVersions(request);
  }

  private static SearchRequest pagedRequest(Query query, int limit) {
    SearchRequest request = new SearchRequest().setQuery(query);
    if (limit > 0) {
      request.setLimit(limit);
    }
    return request;
  }
}
