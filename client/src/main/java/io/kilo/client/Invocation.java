package io.kilo.client;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import io.kilo.client.dispatch.CancellationPolicy;
import io.kilo.client.dispatch.ResultDispatcher;
import io.kilo.client.http.HttpResponse;
import org.jspecify.annotations.Nullable;

/**
 * Handle on an in-flight web service call.
 */
public class Invocation {

    private final long id;
    private final ResultDispatcher<?> dispatcher;
    private final @Nullable CompletableFuture<HttpResponse> exchange;
    private final CancellationPolicy cancellationPolicy;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    Invocation(long id, ResultDispatcher<?> dispatcher, @Nullable CompletableFuture<HttpResponse> exchange,
               CancellationPolicy cancellationPolicy) {
        this.id = id;
        this.dispatcher = dispatcher;
        this.exchange = exchange;
        this.cancellationPolicy = cancellationPolicy;
    }

    public long id() {
        return id;
    }

    /**
     * Cancels the call if it has not completed yet.
     * <p>
     * A successful cancel guarantees the result handler never sees a success. Depending on the
     * proxy's {@link CancellationPolicy} it receives a single cancellation failure, or nothing.
     *
     * @return {@code true} if this call prevented the normal outcome
     */
    public boolean cancel() {
        // claim the dispatcher first so the failing exchange cannot report a plain transport error
        boolean won = dispatcher.cancel(cancellationPolicy);
        if (won) {
            cancelled.set(true);
            if (exchange != null) {
                exchange.cancel(true);
            }
        }
        return won;
    }

    /**
     * Tells whether the terminal outcome has been decided.
     *
     * @return {@code true} after completion or cancellation
     */
    public boolean isDone() {
        return dispatcher.isClaimed();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    @Override
    public String toString() {
        return "Invocation[" + id + "]";
    }
}
