package io.kilo.spec;

import java.util.concurrent.CancellationException;

/**
 * The request did not produce an HTTP response: connection failure, timeout, or cancellation.
 */
public class WebServiceTransportException extends WebServiceException {

    public WebServiceTransportException(Throwable cause) {
        super(cause.getMessage() != null ? cause.getMessage() : WebServiceErrorMessages.TRANSPORT_FAILED, cause);
    }

    public WebServiceTransportException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Tells whether this failure was caused by cancelling the invocation.
     *
     * @return {@code true} if the cause is a {@link CancellationException}
     */
    public boolean isCancellation() {
        return getCause() instanceof CancellationException;
    }
}
