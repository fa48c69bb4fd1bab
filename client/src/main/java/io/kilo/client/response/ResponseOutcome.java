package io.kilo.client.response;

import java.util.List;
import java.util.Map;

import io.kilo.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * The classified result of one exchange, consumed exactly once by the result dispatcher.
 */
public sealed interface ResponseOutcome
        permits ResponseOutcome.Success, ResponseOutcome.HttpError, ResponseOutcome.TransportError {

    /**
     * A 2xx response, still undecoded.
     */
    record Success(byte[] body, @Nullable String contentType, Map<String, List<String>> headers)
            implements ResponseOutcome {

        public Success {
            Assert.checkNotNullParam("body", body);
            Assert.checkNotNullParam("headers", headers);
        }
    }

    /**
     * A response outside the 2xx range.
     *
     * @param statusCode the status code
     * @param message the server text or standard reason phrase, {@code null} if none is known
     */
    record HttpError(int statusCode, @Nullable String message) implements ResponseOutcome {
    }

    /**
     * No response was received.
     *
     * @param cause the transport failure, a {@link java.util.concurrent.CancellationException}
     *              when the exchange was cancelled
     */
    record TransportError(Throwable cause) implements ResponseOutcome {

        public TransportError {
            Assert.checkNotNullParam("cause", cause);
        }
    }
}
