package org.javai.pipeline.boundary;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.javai.pipeline.FailureKind;
import org.javai.pipeline.FailureType;
import org.javai.pipeline.gateway.CacheException;
import org.javai.pipeline.gateway.MappingException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies exceptions raised by gateways into the pipeline's failure taxonomy.
 *
 * <p>Order matters: Jackson's {@link JsonProcessingException} is an {@link IOException},
 * but a response that arrived and could not be parsed is a mapping problem, not a
 * transport problem.
 *
 * <p>The message of a classified failure is the exception's own message so that the
 * rendering layer can show it as is; it is null when the exception carries none.
 */
public class DefaultFailureClassifier implements FailureClassifier {

    @Override
    public FailureKind classify(String operation, Throwable t) {
        String message = t.getMessage();

        // Local store
        if (t instanceof CacheException) {
            return FailureKind.of(FailureType.CACHE, "cache_error", message);
        }

        // Response arrived but is unusable
        if (t instanceof JsonProcessingException) {
            return FailureKind.of(FailureType.MAPPING, "malformed_response", message);
        }

        if (t instanceof MappingException) {
            return FailureKind.of(FailureType.MAPPING, "invalid_record", message);
        }

        // Transport
        if (t instanceof SocketTimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof TimeoutException) {
            return FailureKind.of(FailureType.TRANSPORT, "timeout", message);
        }

        if (t instanceof ConnectException) {
            return FailureKind.of(FailureType.TRANSPORT, "connection_refused", message);
        }

        if (t instanceof UnknownHostException) {
            return FailureKind.of(FailureType.TRANSPORT, "unknown_host", message);
        }

        if (t instanceof IOException) {
            return FailureKind.of(FailureType.TRANSPORT, "io_error", message);
        }

        String name = t.getClass().getSimpleName();
        return FailureKind.of(FailureType.UNKNOWN, name.isEmpty() ? t.getClass().getName() : name, message);
    }
}
