package io.kilo.client.encoding;

import java.util.UUID;

public final class MultipartBoundary {

    private MultipartBoundary() {
    }

    /**
     * Generates a fresh boundary token. A new token is used for every request body so that
     * concurrent calls through the same proxy never share one.
     *
     * @return a random boundary
     */
    public static String generate() {
        return UUID.randomUUID().toString();
    }
}
