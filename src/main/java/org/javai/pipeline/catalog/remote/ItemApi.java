package org.javai.pipeline.catalog.remote;

import java.io.IOException;

/**
 * The remote catalog. Every call blocks until the remote source answers.
 * No retry or backoff happens at this level.
 */
public interface ItemApi {

    ItemPage popular(int page) throws IOException;

    ItemRecord details(int itemId) throws IOException;

    ItemPage search(String query, int page) throws IOException;
}
