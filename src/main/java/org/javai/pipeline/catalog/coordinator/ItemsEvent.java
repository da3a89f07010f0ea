package org.javai.pipeline.catalog.coordinator;

/**
 * One-shot instructions for the view showing catalog items.
 */
public sealed interface ItemsEvent permits ItemsEvent.NavigateToDetails, ItemsEvent.ShowMessage {

    record NavigateToDetails(int itemId) implements ItemsEvent {}

    record ShowMessage(String message) implements ItemsEvent {}
}
