package org.javai.pipeline.catalog.remote;

import org.javai.pipeline.catalog.Item;
import org.javai.pipeline.gateway.MappingException;
import org.javai.pipeline.gateway.Mapper;

/**
 * Maps remote {@link ItemRecord}s to domain {@link Item}s.
 * A missing title is the only thing that makes a record unusable; other missing text becomes empty.
 */
public final class ItemMapper implements Mapper<ItemRecord, Item> {

    @Override
    public Item toDomain(ItemRecord record) {
        if (record.title() == null || record.title().isBlank()) {
            throw new MappingException("Item " + record.id() + " has no title");
        }
        return new Item(
                record.id(),
                record.title(),
                nullToEmpty(record.overview()),
                record.posterPath(),
                record.backdropPath(),
                nullToEmpty(record.releaseDate()),
                record.voteAverage(),
                record.voteCount()
        );
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
