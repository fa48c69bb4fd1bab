package io.kilo.client.dispatch;

/**
 * What the result handler sees when an invocation is cancelled before it completes.
 */
public enum CancellationPolicy {

    /**
     * Deliver a {@link io.kilo.spec.WebServiceTransportException} caused by a
     * {@link java.util.concurrent.CancellationException}.
     */
    DELIVER_FAILURE,

    /** Deliver nothing. */
    SILENT
}
