package io.kilo.client.response;

import java.io.IOException;

import org.jspecify.annotations.Nullable;

/**
 * Decodes the content of a successful response.
 * <p>
 * Decoders run on the thread that completed the exchange, never on the dispatch executor.
 * A decoder that throws turns the call into a
 * {@link io.kilo.spec.WebServiceDecodingException}; no partial result is delivered.
 *
 * @param <T> the result type
 * @see ResponseHandlers
 */
@FunctionalInterface
public interface ResponseHandler<T> {

    /**
     * Decodes response content.
     *
     * @param content the response body, never empty
     * @param contentType the response content type, or {@code null} if the server sent none
     * @return the result, or {@code null}
     * @throws IOException if the content is malformed
     */
    @Nullable T decode(byte[] content, @Nullable String contentType) throws IOException;
}
