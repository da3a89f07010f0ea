package org.javai.pipeline.catalog.coordinator;

import org.javai.pipeline.Failure;
import org.javai.pipeline.PipelineConfig;
import org.javai.pipeline.catalog.Item;
import org.javai.pipeline.catalog.operation.GetItemDetails;
import org.javai.pipeline.coordinator.ScreenState;
import org.javai.pipeline.coordinator.StateCoordinator;

import java.util.Objects;

/**
 * State of the screen showing one item. A stored copy is shown as soon as it is read and
 * replaced when the fresh copy arrives.
 */
public final class ItemDetailsCoordinator extends StateCoordinator<ScreenState<Item>, ItemsEvent> {

    private final int itemId;
    private final GetItemDetails getItemDetails;

    public ItemDetailsCoordinator(int itemId, GetItemDetails getItemDetails, PipelineConfig config) {
        super(ScreenState.loading(), config);
        this.itemId = itemId;
        this.getItemDetails = Objects.requireNonNull(getItemDetails, "getItemDetails must not be null");
        load();
    }

    public int itemId() {
        return itemId;
    }

    public void load() {
        launch(() -> getItemDetails.invoke(itemId), outcome -> {
            ScreenState<Item> next = ScreenState.from(outcome);
            setState(current -> next);
            if (next instanceof ScreenState.Error<Item> error) {
                sendEvent(new ItemsEvent.ShowMessage(error.message()));
            }
        });
    }

    public void retry() {
        load();
    }

    @Override
    protected ScreenState<Item> faultState(Failure failure) {
        return ScreenState.error(failure.messageOrElse(ItemsCoordinator.FAULT_MESSAGE));
    }
}
