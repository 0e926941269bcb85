package io.github.scagogogo.central_search.response;

/** One facet bucket: a distinct field value and the number of matching documents. */
public record FacetValue(String value, long count) {}
