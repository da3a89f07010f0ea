package org.javai.pipeline.catalog.operation;

import org.javai.pipeline.Outcome;
import org.javai.pipeline.catalog.Item;
import org.javai.pipeline.catalog.ItemGateway;
import org.javai.pipeline.operation.NoParamOperation;
import org.javai.pipeline.operation.Operations;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * The popular items, served from the cache when the remote source is unavailable.
 */
public final class GetPopularItems implements NoParamOperation<List<Item>> {

    private final NoParamOperation<List<Item>> delegate;

    public GetPopularItems(ItemGateway gateway, Operations operations) {
        this.delegate = operations.noParams("GetPopularItems", gateway::popularItems);
    }

    @Override
    public Flux<Outcome<List<Item>>> invoke() {
        return delegate.invoke();
    }
}
