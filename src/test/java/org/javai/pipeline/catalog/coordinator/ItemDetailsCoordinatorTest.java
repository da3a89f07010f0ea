package org.javai.pipeline.catalog.coordinator;

import org.javai.pipeline.PipelineConfig;
import org.javai.pipeline.catalog.DefaultItemGateway;
import org.javai.pipeline.catalog.FakeItemApi;
import org.javai.pipeline.catalog.Item;
import org.javai.pipeline.catalog.operation.GetItemDetails;
import org.javai.pipeline.coordinator.ScreenState;
import org.javai.pipeline.gateway.FetchStrategies;
import org.javai.pipeline.operation.Operations;
import org.javai.pipeline.ops.RecordingOpReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;
import static org.javai.pipeline.catalog.FakeItemApi.record;

class ItemDetailsCoordinatorTest {

    private FakeItemApi api;
    private GetItemDetails getItemDetails;
    private PipelineConfig config;

    @BeforeEach
    void setUp() {
        api = new FakeItemApi();
        config = PipelineConfig.builder()
                .background(Schedulers.immediate())
                .foreground(Schedulers.immediate())
                .reporter(new RecordingOpReporter())
                .build();
        DefaultItemGateway gateway = new DefaultItemGateway(api, FetchStrategies.from(config));
        getItemDetails = new GetItemDetails(gateway, Operations.from(config));
    }

    @Test
    void load_showsItem() {
        api.details(record(5, "Five"));

        try (ItemDetailsCoordinator coordinator = new ItemDetailsCoordinator(5, getItemDetails, config)) {
            assertThat(coordinator.currentState()).isInstanceOfSatisfying(ScreenState.Success.class,
                    success -> assertThat(((Item) success.data()).title()).isEqualTo("Five"));
            assertThat(coordinator.itemId()).isEqualTo(5);
        }
    }

    @Test
    void retry_showsStoredCopyBeforeFreshOne() {
        api.details(record(5, "Five"));
        try (ItemDetailsCoordinator coordinator = new ItemDetailsCoordinator(5, getItemDetails, config)) {
            List<ScreenState<Item>> states = new CopyOnWriteArrayList<>();
            coordinator.states().subscribe(states::add);
            states.clear();

            coordinator.retry();

            assertThat(states).hasSize(3);
            assertThat(states.get(0)).isEqualTo(ScreenState.loading());
            assertThat(states.subList(1, 3)).allSatisfy(state ->
                    assertThat(state).isInstanceOf(ScreenState.Success.class));
            assertThat(api.detailsCalls()).isEqualTo(2);
        }
    }

    @Test
    void failureWithoutStoredCopy_showsError() {
        api.failWith(new IOException("HTTP 404 from /3/movie/5"));

        try (ItemDetailsCoordinator coordinator = new ItemDetailsCoordinator(5, getItemDetails, config)) {
            assertThat(coordinator.currentState()).isEqualTo(ScreenState.error("HTTP 404 from /3/movie/5"));
        }
    }

    @Test
    void failureWithStoredCopy_keepsShowingIt() {
        api.details(record(5, "Five"));
        try (ItemDetailsCoordinator coordinator = new ItemDetailsCoordinator(5, getItemDetails, config)) {
            List<ItemsEvent> events = new CopyOnWriteArrayList<>();
            coordinator.events().subscribe(events::add);
            api.failWith(new IOException("offline"));

            coordinator.retry();

            assertThat(coordinator.currentState()).isInstanceOf(ScreenState.Success.class);
            assertThat(events).isEmpty();
        }
    }
}
