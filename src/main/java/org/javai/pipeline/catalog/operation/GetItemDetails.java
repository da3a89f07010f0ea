package org.javai.pipeline.catalog.operation;

import org.javai.pipeline.Outcome;
import org.javai.pipeline.catalog.Item;
import org.javai.pipeline.catalog.ItemGateway;
import org.javai.pipeline.operation.Operation;
import org.javai.pipeline.operation.Operations;
import reactor.core.publisher.Flux;

/**
 * A single item by id. The stored copy, when there is one, arrives before the fresh one.
 */
public final class GetItemDetails implements Operation<Integer, Item> {

    private final Operation<Integer, Item> delegate;

    public GetItemDetails(ItemGateway gateway, Operations operations) {
        this.delegate = operations.streaming("GetItemDetails", gateway::itemDetails);
    }

    @Override
    public Flux<Outcome<Item>> invoke(Integer itemId) {
        return delegate.invoke(itemId);
    }
}
