package io.github.scagogogo.central_search.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Artifact-level document returned by searches without the {@code gav} core.
 *
 * @param id document key, {@code <group>:<artifact>}
 * @param groupId {@code g}
 * @param artifactId {@code a}
 * @param latestVersion newest version known to the index
 * @param repositoryId repository the artifact was indexed from
 * @param packaging {@code p}, e.g. jar, pom
 * @param timestamp last update, epoch millis
 * @param versionCount number of indexed versions
 * @param text free-text tokens
 * @param ec extension/classifier suffixes, e.g. {@code -sources.jar}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Artifact(
    @JsonProperty("id") String id,
    @JsonProperty("g") String groupId,
    @JsonProperty("a") String artifactId,
    @JsonProperty("latestVersion") String latestVersion,
    @JsonProperty("repositoryId") String repositoryId,
    @JsonProperty("p") String packaging,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("versionCount") int versionCount,
    @JsonProperty("text") List<String> text,
    @JsonProperty("ec") List<String> ec)
    implements SearchDocument {}
