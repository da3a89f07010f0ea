package org.javai.pipeline.boundary;

import org.javai.pipeline.FailureKind;

/**
 * Maps an exception caught at a gateway or operation boundary onto the failure taxonomy.
 * Classification must not throw and must not depend on anything but its arguments.
 */
@FunctionalInterface
public interface FailureClassifier {

    /**
     * @param operation The operation that was being performed
     * @param throwable The exception that occurred
     * @return the failure kind, never null
     */
    FailureKind classify(String operation, Throwable throwable);
}
