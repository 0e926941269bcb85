package io.github.scagogogo.central_search.response;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Highlighting block: document id to field name to highlighted fragments.
 *
 * <p>Fragments keep the service's emphasis markers; see {@link HighlightMarkers} to remove or
 * extract them. Lookups use the document id exactly as returned by the service.
 */
public final class Highlighting {

  private final Map<String, Map<String, List<String>>> byDocument;

  @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
  public Highlighting(Map<String, Map<String, List<String>>> byDocument) {
    Map<String, Map<String, List<String>>> copy = new LinkedHashMap<>();
    if (byDocument != null) {
      byDocument.forEach(
          (docId, fields) -> {
            Map<String, List<String>> fieldCopy = new LinkedHashMap<>();
            if (fields != null) {
              fields.forEach(
                  (field, fragments) ->
                      fieldCopy.put(field, fragments == null ? List.of() : List.copyOf(fragments)));
            }
            copy.put(docId, Collections.unmodifiableMap(fieldCopy));
          });
    }
    this.byDocument = Collections.unmodifiableMap(copy);
  }

  /** Ids of all documents that carry highlighting, in service order. */
  public Set<String> documentIds() {
    return byDocument.keySet();
  }

  /**
   * Returns the highlighted fields of one document.
   *
   * @param docId document id
   * @return field name to fragments, empty if the document has no highlighting
   */
  public Map<String, List<String>> forDocumentId(String docId) {
    return byDocument.getOrDefault(docId, Map.of());
  }

  /** Same as {@link #forDocumentId(String)}, keyed by {@link SearchDocument#id()}. */
  public Map<String, List<String>> forDocument(SearchDocument document) {
    return forDocumentId(document.id());
  }

  /**
   * Returns the fragments of one field of one document.
   *
   * @return fragments, empty if the document or field is absent
   */
  public List<String> fragments(String docId, String field) {
    return forDocumentId(docId).getOrDefault(field, List.of());
  }

  /**
   * Collects one field across all documents, skipping documents without fragments for it.
   *
   * @param field highlighted field, e.g. {@code fch}
   * @return document id to fragments, in service order
   */
  public Map<String, List<String>> fieldFragments(String field) {
    Map<String, List<String>> result = new LinkedHashMap<>();
    byDocument.forEach(
        (docId, fields) -> {
          List<String> fragments = fields.get(field);
          if (fragments != null && !fragments.isEmpty()) {
            result.put(docId, fragments);
          }
        });
    return result;
  }

  public int size() {
    return byDocument.size();
  }

  public boolean isEmpty() {
    return byDocument.isEmpty();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    return o instanceof Highlighting other && byDocument.equals(other.byDocument);
  }

  @Override
  public int hashCode() {
    return byDocument.hashCode();
  }

  @Override
  public String toString() {
    return "Highlighting" + byDocument;
  }
}
