package io.github.scagogogo.central_search.request;

import static io.github.scagogogo.central_search.Constants.ARTIFACT_ID_PREFIX;
import static io.github.scagogogo.central_search.Constants.CLASSIFIER_PREFIX;
import static io.github.scagogogo.central_search.Constants.CLASS_NAME_PREFIX;
import static io.github.scagogogo.central_search.Constants.CONJUNCTION;
import static io.github.scagogogo.central_search.Constants.FULLY_QUALIFIED_CLASS_NAME_PREFIX;
import static io.github.scagogogo.central_search.Constants.GROUP_ID_PREFIX;
import static io.github.scagogogo.central_search.Constants.MATCH_ALL;
import static io.github.scagogogo.central_search.Constants.PACKAGING_PREFIX;
import static io.github.scagogogo.central_search.Constants.SHA1_PREFIX;
import static io.github.scagogogo.central_search.Constants.TAGS_PREFIX;
import static io.github.scagogogo.central_search.Constants.VERSION_PREFIX;

import io.github.scagogogo.central_search.util.QueryParamEncoder;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import org.springframework.util.StringUtils;

/**
 * A single search predicate over artifact coordinates and index fields.
 *
 * <p>Every set field contributes one {@code prefix:value} clause and the clauses are joined with
 * {@code AND}. A custom query, when set, replaces all field clauses. A query with nothing set
 * matches every document.
 *
 * <p>Values are not escaped against the search grammar; callers must sanitize values that contain
 * grammar metacharacters themselves.
 *
 * <pre>
 * Query query = new Query().setGroupId("org.apache.commons").setPackaging("jar");
 * query.render(); // g:org.apache.commons AND p:jar
 * </pre>
 */
@Getter
public class Query {

  private String groupId;
  private String artifactId;
  private String version;
  private String tags;
  private String sha1;
  private String className;
  private String fullyQualifiedClassName;
  private String packaging;
  private String classifier;

  /** Raw query-language clause; takes precedence over all field clauses. */
  private String customQuery;

  public Query setGroupId(String groupId) {
    this.groupId = groupId;
    return this;
  }

  public Query setArtifactId(String artifactId) {
    this.artifactId = artifactId;
    return this;
  }

  public Query setVersion(String version) {
    this.version = version;
    return this;
  }

  public Query setTags(String tags) {
    this.tags = tags;
    return this;
  }

  public Query setSha1(String sha1) {
    this.sha1 = sha1;
    return this;
  }

  public Query setClassName(String className) {
    this.className = className;
    return this;
  }

  public Query setFullyQualifiedClassName(String fullyQualifiedClassName) {
    this.fullyQualifiedClassName = fullyQualifiedClassName;
    return this;
  }

  public Query setPackaging(String packaging) {
    this.packaging = packaging;
    return this;
  }

  public Query setClassifier(String classifier) {
    this.classifier = classifier;
    return this;
  }

  public Query setCustomQuery(String customQuery) {
    this.customQuery = customQuery;
    return this;
  }

  /**
   * Renders this predicate in the endpoint's query language.
   *
   * @return the custom query if set, otherwise the non-empty field clauses joined with {@code AND},
   *     or {@code *:*} when no field is set
   */
  public String render() {
    if (StringUtils.hasLength(customQuery)) {
      return customQuery;
    }

    List<String> clauses = new ArrayList<>();
    addClause(clauses, GROUP_ID_PREFIX, groupId);
    addClause(clauses, ARTIFACT_ID_PREFIX, artifactId);
    addClause(clauses, VERSION_PREFIX, version);
    addClause(clauses, TAGS_PREFIX, tags);
    addClause(clauses, SHA1_PREFIX, sha1);
    addClause(clauses, CLASS_NAME_PREFIX, className);
    addClause(clauses, FULLY_QUALIFIED_CLASS_NAME_PREFIX, fullyQualifiedClassName);
    addClause(clauses, PACKAGING_PREFIX, packaging);
    addClause(clauses, CLASSIFIER_PREFIX, classifier);

    if (clauses.isEmpty()) {
      return MATCH_ALL;
    }
    return String.join(CONJUNCTION, clauses);
  }

  /** Returns {@link #render()} encoded for use as the {@code q} parameter value. */
  public String toRequestParamValue() {
    return QueryParamEncoder.encode(render());
  }

  private static void addClause(List<String> clauses, String prefix, String value) {
    if (StringUtils.hasLength(value)) {
      clauses.add(prefix + value);
    }
  }

  @Override
  public String toString() {
    return "Query{" + render() + '}';
  }
}
