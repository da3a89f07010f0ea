package org.javai.pipeline.gateway;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.javai.pipeline.Failure;
import org.javai.pipeline.Outcome;
import org.javai.pipeline.PipelineConfig;
import org.javai.pipeline.boundary.Boundary;
import org.javai.pipeline.boundary.ThrowingSupplier;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns blocking fetch and cache calls into outcome streams.
 *
 * <p>Gateway implementations compose these strategies instead of inheriting them. Every
 * streaming strategy emits {@link Outcome.Pending} first and never terminates with an error:
 * exceptions are classified by the {@link Boundary} and emitted as {@link Outcome.Fail}.
 *
 * <ul>
 *   <li>{@link #plain}: one remote fetch.</li>
 *   <li>{@link #remoteFirst}: remote fetch, falling back to the cache when it fails.
 *       If both fail, the remote failure is surfaced.</li>
 *   <li>{@link #cacheFirst}: the cached value immediately, then a refreshed value from the
 *       remote source. A remote failure is hidden when a cached value was already emitted.</li>
 * </ul>
 *
 * <p>Scheduling is left to the caller; see {@link org.javai.pipeline.operation.Operations}.
 */
public final class FetchStrategies {

    private static final Logger logger = LogManager.getLogger(FetchStrategies.class);

    private final Boundary boundary;
    private final Duration fetchTimeout;

    public static FetchStrategies from(PipelineConfig config) {
        return new FetchStrategies(config.boundary(), config.fetchTimeout().orElse(null));
    }

    /**
     * @param boundary classifies and reports failures
     * @param fetchTimeout limit for each remote fetch, or null for none
     */
    public FetchStrategies(Boundary boundary, Duration fetchTimeout) {
        this.boundary = Objects.requireNonNull(boundary, "boundary must not be null");
        this.fetchTimeout = fetchTimeout;
    }

    /**
     * Pending, then the fetched value or the fetch failure.
     */
    public <T> Flux<Outcome<T>> plain(String operation, ThrowingSupplier<T> fetch) {
        Mono<Outcome<T>> terminal = fetchRemote(operation, fetch)
                .map(Outcome::ok)
                .onErrorResume(error -> Mono.just(Outcome.<T>fail(boundary.reportFailure(operation, error))));
        return Flux.concat(Mono.just(Outcome.<T>pending()), terminal);
    }

    /**
     * Pending, then the fetched value (also written to the cache). When the fetch fails,
     * the cached value is emitted instead and the remote failure is reported as suppressed.
     * With no usable cached value the remote failure is emitted, never the cache failure.
     */
    public <T> Flux<Outcome<T>> remoteFirst(String operation, QueryKey key,
                                            ThrowingSupplier<T> fetch, Cache<QueryKey, T> cache) {
        Mono<Outcome<T>> terminal = fetchRemote(operation, fetch)
                .map(value -> {
                    store(operation, key, value, cache);
                    return Outcome.ok(value);
                })
                .onErrorResume(error -> Mono.fromSupplier(
                        () -> fallBackToCache(operation, key, cache, boundary.classify(operation, error))));
        return Flux.concat(Mono.just(Outcome.<T>pending()), terminal);
    }

    /**
     * Pending, the cached value if there is one, then the fetched value (also written to the
     * cache). A failed fetch is emitted only when no cached value was emitted before it.
     */
    public <T> Flux<Outcome<T>> cacheFirst(String operation, QueryKey key,
                                           ThrowingSupplier<T> fetch, Cache<QueryKey, T> cache) {
        Flux<Outcome<T>> results = Flux.defer(() -> {
            Optional<T> cached = readQuietly(operation, key, cache);

            Mono<Outcome<T>> fresh = fetchRemote(operation, fetch)
                    .map(value -> {
                        store(operation, key, value, cache);
                        return Outcome.<T>ok(value);
                    })
                    .onErrorResume(error -> {
                        Failure failure = boundary.classify(operation, error);
                        if (cached.isPresent()) {
                            boundary.reporter().reportSuppressed(failure, "kept cached value for " + key);
                            return Mono.empty();
                        }
                        boundary.reporter().report(failure);
                        return Mono.just(Outcome.<T>fail(failure));
                    });

            return cached
                    .map(value -> Flux.concat(Mono.just(Outcome.<T>ok(value)), fresh))
                    .orElseGet(fresh::flux);
        });
        return Flux.concat(Mono.just(Outcome.<T>pending()), results);
    }

    /**
     * A single fetch with no intermediate Pending: exactly one Ok or Fail.
     */
    public <T> Mono<Outcome<T>> single(String operation, ThrowingSupplier<T> fetch) {
        return fetchRemote(operation, fetch)
                .map(Outcome::ok)
                .onErrorResume(error -> Mono.just(Outcome.<T>fail(boundary.reportFailure(operation, error))));
    }

    /**
     * Like {@link #single}, additionally writing a fetched value to the cache.
     * There is no fallback: a failed fetch is emitted as is.
     */
    public <T> Mono<Outcome<T>> refresh(String operation, QueryKey key,
                                        ThrowingSupplier<T> fetch, Cache<QueryKey, T> cache) {
        return fetchRemote(operation, fetch)
                .map(value -> {
                    store(operation, key, value, cache);
                    return Outcome.<T>ok(value);
                })
                .onErrorResume(error -> Mono.just(Outcome.<T>fail(boundary.reportFailure(operation, error))));
    }

    private <T> Mono<T> fetchRemote(String operation, ThrowingSupplier<T> fetch) {
        Mono<T> call = Mono.fromCallable(() -> {
            T value = fetch.get();
            if (value == null) {
                throw new IllegalStateException(operation + " returned no value");
            }
            return value;
        });
        return fetchTimeout == null ? call : call.timeout(fetchTimeout);
    }

    private <T> Outcome<T> fallBackToCache(String operation, QueryKey key, Cache<QueryKey, T> cache,
                                           Failure remoteFailure) {
        Optional<T> cached;
        try {
            cached = cache.read(key);
        } catch (Exception e) {
            boundary.reporter().reportSuppressed(boundary.classify(operation, e),
                    "cache fallback for " + key + " unavailable");
            boundary.reporter().report(remoteFailure);
            return Outcome.fail(remoteFailure);
        }

        if (cached.isPresent()) {
            logger.debug("{} failed remotely, serving cached {}", operation, key);
            boundary.reporter().reportSuppressed(remoteFailure, "served cached value for " + key);
            return Outcome.ok(cached.get());
        }

        boundary.reporter().report(remoteFailure);
        return Outcome.fail(remoteFailure);
    }

    private <T> Optional<T> readQuietly(String operation, QueryKey key, Cache<QueryKey, T> cache) {
        try {
            return cache.read(key);
        } catch (Exception e) {
            boundary.reporter().reportSuppressed(boundary.classify(operation, e),
                    "treated " + key + " as not cached");
            return Optional.empty();
        }
    }

    private <T> void store(String operation, QueryKey key, T value, Cache<QueryKey, T> cache) {
        try {
            cache.write(key, value);
        } catch (Exception e) {
            boundary.reporter().reportSuppressed(boundary.classify(operation, e),
                    "fresh value for " + key + " not cached");
        }
    }
}
