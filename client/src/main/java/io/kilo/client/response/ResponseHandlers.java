package io.kilo.client.response;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

import com.fasterxml.jackson.core.type.TypeReference;
import io.kilo.util.Assert;
import io.kilo.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Stock {@link ResponseHandler}s for JSON, text and binary content.
 */
public final class ResponseHandlers {

    public static final String APPLICATION_JSON = "application/json";

    private ResponseHandlers() {
    }

    /**
     * Decodes {@code application/json} content with the shared object mapper. Content of any
     * other type yields a {@code null} result.
     */
    public static <T> ResponseHandler<T> json(Class<T> type) {
        Assert.checkNotNullParam("type", type);
        return (content, contentType) -> isJson(contentType) ? Utils.unmarshalFrom(content, type) : null;
    }

    /**
     * Decodes {@code application/json} content with the shared object mapper. Content of any
     * other type yields a {@code null} result.
     */
    public static <T> ResponseHandler<T> json(TypeReference<T> typeReference) {
        Assert.checkNotNullParam("typeReference", typeReference);
        return (content, contentType) -> isJson(contentType) ? Utils.unmarshalFrom(content, typeReference) : null;
    }

    public static ResponseHandler<String> text() {
        return (content, contentType) -> new String(content, StandardCharsets.UTF_8);
    }

    public static ResponseHandler<byte[]> bytes() {
        return (content, contentType) -> content;
    }

    static boolean isJson(@Nullable String contentType) {
        return contentType != null && contentType.trim().toLowerCase(Locale.ROOT).startsWith(APPLICATION_JSON);
    }
}
