package org.javai.pipeline.catalog.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One page of items from a list or search endpoint.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ItemPage(
        @JsonProperty("page") int page,
        @JsonProperty("results") List<ItemRecord> results,
        @JsonProperty("total_pages") int totalPages,
        @JsonProperty("total_results") int totalResults
) {

    public ItemPage {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
