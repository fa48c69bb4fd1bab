package io.kilo.client.request;

import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.kilo.util.Assert;
import io.kilo.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * An explicit request body supplied by the caller.
 * <p>
 * When a call carries explicit content, its arguments always travel in the query string, even
 * for {@code POST}. Without a content type the body is sent as {@code application/octet-stream}.
 *
 * @param bytes the body
 * @param contentType the media type of the body, or {@code null} for the default
 */
public record RequestContent(byte[] bytes, @Nullable String contentType) {

    public static final String APPLICATION_JSON = "application/json";
    public static final String TEXT_PLAIN = "text/plain";

    public RequestContent {
        Assert.checkNotNullParam("bytes", bytes);
    }

    public static RequestContent of(byte[] bytes) {
        return new RequestContent(bytes, null);
    }

    public static RequestContent of(byte[] bytes, String contentType) {
        return new RequestContent(bytes, contentType);
    }

    public static RequestContent text(String text) {
        return new RequestContent(text.getBytes(StandardCharsets.UTF_8), TEXT_PLAIN + "; charset=UTF-8");
    }

    /**
     * Serialises a value as JSON. Dates are written as epoch milliseconds.
     *
     * @param value the value to serialise
     * @return the content, typed {@code application/json}
     * @throws JsonProcessingException if the value cannot be serialised
     */
    public static RequestContent json(Object value) throws JsonProcessingException {
        return new RequestContent(Utils.marshalToBytes(value), APPLICATION_JSON);
    }
}
