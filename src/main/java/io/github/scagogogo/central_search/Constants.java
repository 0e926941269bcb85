package io.github.scagogogo.central_search;

/**
 * Query-language and wire constants shared by the request builder and the response decoder.
 * This class is non-instantiable.
 */
public final class Constants {

  /** Clause matching every document, rendered for a query with no field set. */
  public static final String MATCH_ALL = "*:*";

  /** Conjunction placed between field clauses. */
  public static final String CONJUNCTION = " AND ";

  // Field prefixes understood by the search endpoint
  public static final String GROUP_ID_PREFIX = "g:";
  public static final String ARTIFACT_ID_PREFIX = "a:";
  public static final String VERSION_PREFIX = "v:";
  public static final String TAGS_PREFIX = "tags:";
  public static final String SHA1_PREFIX = "1:";
  public static final String CLASS_NAME_PREFIX = "c:";
  public static final String FULLY_QUALIFIED_CLASS_NAME_PREFIX = "fc:";
  public static final String PACKAGING_PREFIX = "p:";
  public static final String CLASSIFIER_PREFIX = "l:";
  public static final String DEPENDENCY_PREFIX = "d:";
  public static final String LICENSE_PREFIX = "l:";

  /** Response format requested on every call; the decoder only understands JSON. */
  public static final String RESPONSE_FORMAT = "json";

  /** Core holding one document per groupId:artifactId:version. */
  public static final String GAV_CORE = "gav";

  /**
   * Highlighting field holding fully qualified class names.
   */
  public static final String CLASS_HIGHLIGHT_FIELD = "fch";

  public static final String EMPHASIS_OPEN = "<em>";
  public static final String EMPHASIS_CLOSE = "</em>";

  // Private constructor to prevent instantiation
  private Constants() {
    throw new UnsupportedOperationException("Constants class cannot be instantiated");
  }
}
