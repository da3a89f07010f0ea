package org.javai.pipeline.gateway;

import java.util.List;

/**
 * Converts raw records delivered by a remote source into domain values.
 * Implementations are pure and side-effect free.
 *
 * @param <R> raw record type
 * @param <D> domain type
 */
@FunctionalInterface
public interface Mapper<R, D> {

    /**
     * @throws MappingException if the record lacks data the domain value requires
     */
    D toDomain(R record);

    default List<D> toDomainList(List<? extends R> records) {
        return records.stream().map(this::toDomain).toList();
    }
}
