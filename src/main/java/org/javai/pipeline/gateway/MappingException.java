package org.javai.pipeline.gateway;

/**
 * Thrown by a {@link Mapper} when a raw record cannot be turned into a domain value.
 */
public class MappingException extends RuntimeException {

    public MappingException(String message) {
        super(message);
    }
}
