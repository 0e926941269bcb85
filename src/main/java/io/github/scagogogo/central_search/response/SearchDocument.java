package io.github.scagogogo.central_search.response;

/**
 * A document shape a {@link ResponseEnvelope} can be decoded over.
 *
 * <p>The only shared capability is the identifying key, which the service also uses to key the
 * highlighting block (conventionally {@code <group>:<artifact>:<version>}, not validated here).
 */
public interface SearchDocument {

  String id();
}
