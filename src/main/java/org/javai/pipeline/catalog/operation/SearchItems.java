package org.javai.pipeline.catalog.operation;

import org.javai.pipeline.Outcome;
import org.javai.pipeline.catalog.Item;
import org.javai.pipeline.catalog.ItemGateway;
import org.javai.pipeline.operation.Operation;
import org.javai.pipeline.operation.Operations;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Items whose title matches a query.
 *
 * <p>A query shorter than {@value #MIN_QUERY_LENGTH} characters, counted as typed with no
 * trimming, yields an empty list without calling the gateway. That is a normal result,
 * not a failure.
 */
public final class SearchItems implements Operation<String, List<Item>> {

    public static final int MIN_QUERY_LENGTH = 3;

    private final Operation<String, List<Item>> delegate;

    public SearchItems(ItemGateway gateway, Operations operations) {
        this.delegate = operations.streaming("SearchItems", query -> {
            if (query == null || query.length() < MIN_QUERY_LENGTH) {
                return Flux.just(Outcome.<List<Item>>ok(List.of()));
            }
            return gateway.searchItems(query);
        });
    }

    @Override
    public Flux<Outcome<List<Item>>> invoke(String query) {
        return delegate.invoke(query);
    }
}
