package io.kilo.client;

import io.kilo.spec.WebServiceException;
import org.jspecify.annotations.Nullable;

/**
 * Receives the result of a web service call.
 * <p>
 * Called exactly once per invocation, on the proxy's dispatch executor, with either a result
 * (possibly {@code null} for empty or non-decodable content) or an error.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface ResultHandler<T> {

    void execute(@Nullable T result, @Nullable WebServiceException error);
}
