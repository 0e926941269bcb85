package io.github.scagogogo.central_search.response;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Version-level document returned by searches on the {@code gav} core.
 *
 * @param id document key, {@code <group>:<artifact>:<version>}
 * @param groupId {@code g}
 * @param artifactId {@code a}
 * @param version {@code v}
 * @param packaging {@code p}
 * @param timestamp publication time, epoch millis
 * @param ec extension/classifier suffixes
 * @param tags free-text tags
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Version(
    @JsonProperty("id") String id,
    @JsonProperty("g") String groupId,
    @JsonProperty("a") String artifactId,
    @JsonProperty("v") String version,
    @JsonProperty("p") String packaging,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("ec") List<String> ec,
    @JsonProperty("tags") List<String> tags)
    implements SearchDocument {}
