package io.github.scagogogo.central_search.request;

import static io.github.scagogogo.central_search.Constants.DEPENDENCY_PREFIX;
import static io.github.scagogogo.central_search.Constants.LICENSE_PREFIX;

import lombok.Getter;
import org.springframework.util.StringUtils;

/**
 * Coordinate-based search options (groupId, artifactId, version, packaging, classifier) plus
 * helpers that build dependency and license clauses for {@link Query#setCustomQuery(String)}.
 */
@Getter
public class AdvancedSearchOptions {

  private String groupId;
  private String artifactId;
  private String version;
  private String packaging;
  private String classifier;

  public AdvancedSearchOptions setGroupId(String groupId) {
    this.groupId = groupId;
    return this;
  }

  public AdvancedSearchOptions setArtifactId(String artifactId) {
    this.artifactId = artifactId;
    return this;
  }

  public AdvancedSearchOptions setVersion(String version) {
    this.version = version;
    return this;
  }

  public AdvancedSearchOptions setPackaging(String packaging) {
    this.packaging = packaging;
    return this;
  }

  public AdvancedSearchOptions setClassifier(String classifier) {
    this.classifier = classifier;
    return this;
  }

  /**
   * Builds the equivalent {@link Query}, copying only the options that are set.
   *
   * @return a new query
   */
  public Query toQuery() {
    Query query = new Query();
    if (StringUtils.hasLength(groupId)) {
      query.setGroupId(groupId);
    }
    if (StringUtils.hasLength(artifactId)) {
      query.setArtifactId(artifactId);
    }
    if (StringUtils.hasLength(version)) {
      query.setVersion(version);
    }
    if (StringUtils.hasLength(packaging)) {
      query.setPackaging(packaging);
    }
    if (StringUtils.hasLength(classifier)) {
      query.setClassifier(classifier);
    }
    return query;
  }

  /**
   * Builds a clause matching artifacts that declare the given dependency.
   *
   * <ul>
   *   <li>groupId and artifactId: {@code d:<groupId>:<artifactId>}
   *   <li>groupId only: {@code d:<groupId>}
   *   <li>artifactId only: {@code d:*:<artifactId>}
   *   <li>neither: empty string, meaning no clause
   * </ul>
   *
   * @param groupId dependency groupId, may be null or empty
   * @param artifactId dependency artifactId, may be null or empty
   * @return the clause, or an empty string when both are empty
   */
  public static String makeDependencyQuery(String groupId, String artifactId) {
    boolean hasGroup = StringUtils.hasLength(groupId);
    boolean hasArtifact = StringUtils.hasLength(artifactId);
    if (hasGroup && hasArtifact) {
      return DEPENDENCY_PREFIX + groupId + ":" + artifactId;
    } else if (hasGroup) {
      return DEPENDENCY_PREFIX + groupId;
    } else if (hasArtifact) {
      return DEPENDENCY_PREFIX + "*:" + artifactId;
    }
    return "";
  }

  /**
   * Builds a license clause. The license is not checked, so an empty value yields {@code l:}.
   *
   * @param license license name
   * @return {@code l:<license>}
   */
  public static String makeLicenseQuery(String license) {
    return LICENSE_PREFIX + license;
  }
}
