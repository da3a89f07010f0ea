package org.javai.pipeline.catalog;

import org.javai.pipeline.Outcome;
import org.javai.pipeline.catalog.remote.ItemApi;
import org.javai.pipeline.catalog.remote.ItemMapper;
import org.javai.pipeline.catalog.remote.ItemRecord;
import org.javai.pipeline.gateway.Cache;
import org.javai.pipeline.gateway.FetchStrategies;
import org.javai.pipeline.gateway.InMemoryCache;
import org.javai.pipeline.gateway.Mapper;
import org.javai.pipeline.gateway.QueryKey;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.List;
import java.util.Objects;

/**
 * {@link ItemGateway} over an {@link ItemApi} and two local caches.
 *
 * <ul>
 *   <li>popular items: remote first, cached list as fallback</li>
 *   <li>item details: cached item first, then refreshed from the remote source</li>
 *   <li>search: remote only</li>
 * </ul>
 */
public final class DefaultItemGateway implements ItemGateway {

    static final QueryKey POPULAR_ITEMS = QueryKey.of("popular-items");
    static final int FIRST_PAGE = 1;

    private final ItemApi api;
    private final Mapper<ItemRecord, Item> mapper;
    private final Cache<QueryKey, List<Item>> listCache;
    private final Cache<QueryKey, Item> itemCache;
    private final FetchStrategies strategies;

    public DefaultItemGateway(ItemApi api, FetchStrategies strategies) {
        this(api, new ItemMapper(), new InMemoryCache<>(), new InMemoryCache<>(), strategies);
    }

    public DefaultItemGateway(ItemApi api,
                              Mapper<ItemRecord, Item> mapper,
                              Cache<QueryKey, List<Item>> listCache,
                              Cache<QueryKey, Item> itemCache,
                              FetchStrategies strategies) {
        this.api = Objects.requireNonNull(api, "api must not be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper must not be null");
        this.listCache = Objects.requireNonNull(listCache, "listCache must not be null");
        this.itemCache = Objects.requireNonNull(itemCache, "itemCache must not be null");
        this.strategies = Objects.requireNonNull(strategies, "strategies must not be null");
    }

    @Override
    public Flux<Outcome<List<Item>>> popularItems() {
        return strategies.remoteFirst("ItemGateway.popularItems", POPULAR_ITEMS,
                this::fetchPopular, listCache);
    }

    @Override
    public Flux<Outcome<Item>> itemDetails(int itemId) {
        return strategies.cacheFirst("ItemGateway.itemDetails", detailsKey(itemId),
                () -> mapper.toDomain(api.details(itemId)), itemCache);
    }

    @Override
    public Flux<Outcome<List<Item>>> searchItems(String query) {
        return strategies.plain("ItemGateway.searchItems",
                () -> mapper.toDomainList(api.search(query, FIRST_PAGE).results()));
    }

    @Override
    public Mono<Outcome<List<Item>>> refreshPopularItems() {
        return strategies.refresh("ItemGateway.refreshPopularItems", POPULAR_ITEMS,
                this::fetchPopular, listCache);
    }

    static QueryKey detailsKey(int itemId) {
        return QueryKey.of("item-details", itemId);
    }

    private List<Item> fetchPopular() throws IOException {
        return mapper.toDomainList(api.popular(FIRST_PAGE).results());
    }
}
