package io.kilo.client.request;

import java.net.URI;
import java.util.Map;

import io.kilo.spec.HttpMethod;
import org.jspecify.annotations.Nullable;

/**
 * A transport-ready request.
 *
 * @param method the HTTP method
 * @param uri the absolute URI, query string included
 * @param headers the headers to send, {@code Content-Type} included when there is a body
 * @param body the body, or {@code null} for none
 * @param contentType the content type of the body, or {@code null} when there is no body
 */
public record RequestDescriptor(HttpMethod method,
                                URI uri,
                                Map<String, String> headers,
                                byte @Nullable [] body,
                                @Nullable String contentType) {

    /**
     * Returns the raw path and query, as sent on the request line.
     *
     * @return e.g. {@code /httprpc-test/test?number=123}
     */
    public String pathAndQuery() {
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        String query = uri.getRawQuery();
        return query == null ? path : path + "?" + query;
    }

    public @Nullable String query() {
        return uri.getRawQuery();
    }
}
