package io.kilo.client.http;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import org.jspecify.annotations.Nullable;

/**
 * A fully received HTTP response.
 */
public interface HttpResponse {
    int statusCode();

    default boolean success() {
        return statusCode() >= 200 && statusCode() < 300;
    }

    /**
     * Returns the {@code Content-Type} header, parameters included.
     *
     * @return the content type, or {@code null} if the server sent none
     */
    @Nullable String contentType();

    Map<String, List<String>> headers();

    /**
     * Returns the response body.
     *
     * @return the body bytes, empty but never {@code null}
     */
    byte[] body();

    default String bodyAsString() {
        return new String(body(), StandardCharsets.UTF_8);
    }
}
