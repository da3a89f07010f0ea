package org.javai.pipeline.catalog;

import org.javai.pipeline.Outcome;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * The queries the catalog operations depend on. Says nothing about transport or storage.
 *
 * <p>Streaming queries emit {@link Outcome.Pending} first and never terminate with an error.
 */
public interface ItemGateway {

    /**
     * The current list of popular items.
     */
    Flux<Outcome<List<Item>>> popularItems();

    /**
     * A single item. May emit a stored copy before the up-to-date one.
     */
    Flux<Outcome<Item>> itemDetails(int itemId);

    /**
     * Items matching {@code query}.
     */
    Flux<Outcome<List<Item>>> searchItems(String query);

    /**
     * Fetches the popular items again and stores them, with no fallback.
     */
    Mono<Outcome<List<Item>>> refreshPopularItems();
}
