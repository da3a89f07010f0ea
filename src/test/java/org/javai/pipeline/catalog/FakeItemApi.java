package org.javai.pipeline.catalog;

import org.javai.pipeline.catalog.remote.ItemApi;
import org.javai.pipeline.catalog.remote.ItemPage;
import org.javai.pipeline.catalog.remote.ItemRecord;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * An {@link ItemApi} serving canned records, switchable to failing with an {@link IOException}.
 */
public class FakeItemApi implements ItemApi {

    private volatile List<ItemRecord> popular = List.of();
    private volatile List<ItemRecord> searchResults = List.of();
    private volatile ItemRecord details;
    private volatile IOException failure;

    private final AtomicInteger popularCalls = new AtomicInteger();
    private final AtomicInteger detailsCalls = new AtomicInteger();
    private final AtomicInteger searchCalls = new AtomicInteger();

    public static ItemRecord record(int id, String title) {
        return new ItemRecord(id, title, "Overview of " + title, "/p" + id + ".jpg", null, "2024-01-01", 7.5, 100);
    }

    public FakeItemApi popular(ItemRecord... records) {
        this.popular = List.of(records);
        return this;
    }

    public FakeItemApi searchResults(ItemRecord... records) {
        this.searchResults = List.of(records);
        return this;
    }

    public FakeItemApi details(ItemRecord record) {
        this.details = record;
        return this;
    }

    public FakeItemApi failWith(IOException failure) {
        this.failure = failure;
        return this;
    }

    public FakeItemApi recover() {
        this.failure = null;
        return this;
    }

    @Override
    public ItemPage popular(int page) throws IOException {
        popularCalls.incrementAndGet();
        throwIfFailing();
        return new ItemPage(page, popular, 1, popular.size());
    }

    @Override
    public ItemRecord details(int itemId) throws IOException {
        detailsCalls.incrementAndGet();
        throwIfFailing();
        if (details == null || details.id() != itemId) {
            throw new IOException("HTTP 404 from /3/movie/" + itemId);
        }
        return details;
    }

    @Override
    public ItemPage search(String query, int page) throws IOException {
        searchCalls.incrementAndGet();
        throwIfFailing();
        return new ItemPage(page, searchResults, 1, searchResults.size());
    }

    public int popularCalls() {
        return popularCalls.get();
    }

    public int detailsCalls() {
        return detailsCalls.get();
    }

    public int searchCalls() {
        return searchCalls.get();
    }

    private void throwIfFailing() throws IOException {
        IOException current = failure;
        if (current != null) {
            throw current;
        }
    }
}
