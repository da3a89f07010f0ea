package org.javai.pipeline.gateway;

/**
 * Signals that a {@link Cache} could not be read or written.
 */
public class CacheException extends Exception {

    public CacheException(String message) {
        super(message);
    }

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
