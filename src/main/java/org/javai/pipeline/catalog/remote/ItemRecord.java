package org.javai.pipeline.catalog.remote;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An item as delivered by the remote catalog. Kept apart from the domain
 * {@link org.javai.pipeline.catalog.Item} so that wire changes stay in this package.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ItemRecord(
        @JsonProperty("id") int id,
        @JsonProperty("title") String title,
        @JsonProperty("overview") String overview,
        @JsonProperty("poster_path") String posterPath,
        @JsonProperty("backdrop_path") String backdropPath,
        @JsonProperty("release_date") String releaseDate,
        @JsonProperty("vote_average") double voteAverage,
        @JsonProperty("vote_count") int voteCount
) {
}
