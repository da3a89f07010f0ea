package org.javai.pipeline.catalog.operation;

import org.javai.pipeline.Outcome;
import org.javai.pipeline.catalog.Item;
import org.javai.pipeline.catalog.ItemGateway;
import org.javai.pipeline.operation.Operations;
import org.javai.pipeline.operation.SingleShotOperation;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fetches the popular items again and replaces the stored copy. Answers once, with no
 * fallback to the stored copy.
 */
public final class RefreshPopularItems implements SingleShotOperation<Void, List<Item>> {

    private final SingleShotOperation<Void, List<Item>> delegate;

    public RefreshPopularItems(ItemGateway gateway, Operations operations) {
        this.delegate = operations.singleShot("RefreshPopularItems", ignored -> gateway.refreshPopularItems());
    }

    @Override
    public Mono<Outcome<List<Item>>> invoke(Void ignored) {
        return delegate.invoke(ignored);
    }

    public Mono<Outcome<List<Item>>> invoke() {
        return invoke(null);
    }
}
