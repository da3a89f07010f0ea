package org.javai.pipeline.catalog;

import java.util.Objects;

/**
 * A catalog entry as shown to the user.
 *
 * @param posterPath relative poster image path, may be null
 * @param backdropPath relative backdrop image path, may be null
 */
public record Item(
        int id,
        String title,
        String overview,
        String posterPath,
        String backdropPath,
        String releaseDate,
        double voteAverage,
        int voteCount
) {

    public Item {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(overview, "overview must not be null");
        Objects.requireNonNull(releaseDate, "releaseDate must not be null");
    }
}
