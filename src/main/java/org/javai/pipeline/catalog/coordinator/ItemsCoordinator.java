package org.javai.pipeline.catalog.coordinator;

import org.javai.pipeline.Failure;
import org.javai.pipeline.Outcome;
import org.javai.pipeline.PipelineConfig;
import org.javai.pipeline.catalog.Item;
import org.javai.pipeline.catalog.operation.GetPopularItems;
import org.javai.pipeline.catalog.operation.RefreshPopularItems;
import org.javai.pipeline.catalog.operation.SearchItems;
import org.javai.pipeline.coordinator.ScreenState;
import org.javai.pipeline.coordinator.StateCoordinator;

import java.util.List;
import java.util.Objects;

/**
 * State of the item list screen: the popular items, or the results of the last search.
 *
 * <p>The popular items start loading on construction. Failures show as
 * {@link ScreenState.Error} and are also announced with {@link ItemsEvent.ShowMessage}.
 * Concurrent loads are not fenced; whichever result arrives last is shown.
 */
public final class ItemsCoordinator extends StateCoordinator<ScreenState<List<Item>>, ItemsEvent> {

    static final String FAULT_MESSAGE = "Unknown error";

    private final GetPopularItems getPopularItems;
    private final SearchItems searchItems;
    private final RefreshPopularItems refreshPopularItems;

    private volatile String lastQuery;

    public ItemsCoordinator(GetPopularItems getPopularItems,
                            SearchItems searchItems,
                            RefreshPopularItems refreshPopularItems,
                            PipelineConfig config) {
        super(ScreenState.loading(), config);
        this.getPopularItems = Objects.requireNonNull(getPopularItems, "getPopularItems must not be null");
        this.searchItems = Objects.requireNonNull(searchItems, "searchItems must not be null");
        this.refreshPopularItems = Objects.requireNonNull(refreshPopularItems, "refreshPopularItems must not be null");
        loadItems();
    }

    public void loadItems() {
        lastQuery = null;
        launch(getPopularItems::invoke, this::reduce);
    }

    /**
     * Searches for {@code query}. A blank query goes back to the popular items.
     */
    public void search(String query) {
        if (query == null || query.isBlank()) {
            loadItems();
            return;
        }
        lastQuery = query;
        launch(() -> searchItems.invoke(query), this::reduce);
    }

    /**
     * Runs the last query again, from a fresh {@link ScreenState.Loading}.
     */
    public void retry() {
        String query = lastQuery;
        if (query == null) {
            loadItems();
        } else {
            search(query);
        }
    }

    /**
     * Replaces the popular items with freshly fetched ones. A failed refresh leaves the
     * current state in place and only shows a message.
     */
    public void refresh() {
        launch(() -> refreshPopularItems.invoke(), outcome -> {
            if (outcome instanceof Outcome.Fail<List<Item>> fail) {
                sendEvent(new ItemsEvent.ShowMessage(
                        fail.failure().messageOrElse(ScreenState.DEFAULT_ERROR_MESSAGE)));
                return;
            }
            lastQuery = null;
            setState(current -> ScreenState.from(outcome));
        });
    }

    public void onItemClick(int itemId) {
        sendEvent(new ItemsEvent.NavigateToDetails(itemId));
    }

    @Override
    protected ScreenState<List<Item>> faultState(Failure failure) {
        return ScreenState.error(failure.messageOrElse(FAULT_MESSAGE));
    }

    private void reduce(Outcome<List<Item>> outcome) {
        ScreenState<List<Item>> next = ScreenState.from(outcome);
        setState(current -> next);
        if (next instanceof ScreenState.Error<List<Item>> error) {
            sendEvent(new ItemsEvent.ShowMessage(error.message()));
        }
    }
}
