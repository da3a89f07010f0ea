package org.javai.pipeline;

/**
 * Classifies failures by the layer that produced them.
 */
public enum FailureType {
    /**
     * The remote source could not be reached or answered with an error.
     * Examples: connection refused, timeout, unexpected HTTP status.
     */
    TRANSPORT,

    /**
     * The remote source answered, but the response could not be turned into domain values.
     * Examples: malformed JSON, a record missing a required field.
     */
    MAPPING,

    /**
     * The local cache could not be read or written.
     */
    CACHE,

    /**
     * An exception was raised inside a coordinator's own reaction logic.
     */
    COORDINATOR,

    /**
     * Nothing more specific is known about the failure.
     */
    UNKNOWN
}
