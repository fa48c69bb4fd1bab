package io.kilo.client.dispatch;

import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import io.kilo.client.ResultHandler;
import io.kilo.client.response.ResponseHandler;
import io.kilo.client.response.ResponseOutcome;
import io.kilo.spec.WebServiceDecodingException;
import io.kilo.spec.WebServiceErrorMessages;
import io.kilo.spec.WebServiceException;
import io.kilo.spec.WebServiceHttpException;
import io.kilo.spec.WebServiceTransportException;
import io.kilo.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers the terminal outcome of one invocation to its {@link ResultHandler}.
 * <p>
 * Decoding happens on the thread that calls {@link #complete}; only the handler call is
 * handed to the dispatch executor. The first of {@link #complete}, {@link #fail} and
 * {@link #cancel} to claim the dispatcher wins, every later call is dropped, so the handler
 * runs at most once and, unless cancellation is silent, exactly once.
 *
 * @param <T> the result type
 */
public class ResultDispatcher<T> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ResultDispatcher.class);

    private final long invocationId;
    private final ResultHandler<T> resultHandler;
    private final Executor dispatchExecutor;
    private final AtomicBoolean claimed = new AtomicBoolean();

    public ResultDispatcher(long invocationId, ResultHandler<T> resultHandler, Executor dispatchExecutor) {
        this.invocationId = invocationId;
        this.resultHandler = Assert.checkNotNullParam("resultHandler", resultHandler);
        this.dispatchExecutor = Assert.checkNotNullParam("dispatchExecutor", dispatchExecutor);
    }

    public long getInvocationId() {
        return invocationId;
    }

    /**
     * Tells whether a terminal outcome has been claimed.
     *
     * @return {@code true} once the handler has been scheduled or a silent cancel happened
     */
    public boolean isClaimed() {
        return claimed.get();
    }

    /**
     * Decodes a classified outcome on the calling thread and dispatches the result.
     *
     * @param outcome the classified exchange result
     * @param responseHandler the decoder applied to a successful, non-empty body
     */
    public void complete(ResponseOutcome outcome, ResponseHandler<T> responseHandler) {
        if (claimed.get()) {
            LOGGER.debug("Invocation {} already completed, dropping {}", invocationId, outcome.getClass().getSimpleName());
            return;
        }

        if (outcome instanceof ResponseOutcome.Success success) {
            T result;
            try {
                result = success.body().length > 0 ? responseHandler.decode(success.body(), success.contentType()) : null;
            } catch (Exception e) {
                LOGGER.debug("Invocation {} could not decode {} content: {}", invocationId, success.contentType(), e.getMessage());
                dispatch(null, new WebServiceDecodingException(WebServiceErrorMessages.DECODING_FAILED + ": " + e.getMessage(), e));
                return;
            }
            dispatch(result, null);
        } else if (outcome instanceof ResponseOutcome.HttpError httpError) {
            dispatch(null, new WebServiceHttpException(httpError.statusCode(), httpError.message()));
        } else if (outcome instanceof ResponseOutcome.TransportError transportError) {
            dispatch(null, new WebServiceTransportException(transportError.cause()));
        }
    }

    /**
     * Dispatches a failure that happened before any exchange, e.g. while encoding.
     *
     * @param error the failure
     */
    public void fail(WebServiceException error) {
        Assert.checkNotNullParam("error", error);
        dispatch(null, error);
    }

    /**
     * Claims the dispatcher for a cancellation.
     *
     * @param policy whether to deliver a failure or nothing
     * @return {@code true} if the cancellation won, {@code false} if an outcome was already claimed
     */
    public boolean cancel(CancellationPolicy policy) {
        Assert.checkNotNullParam("policy", policy);

        if (policy == CancellationPolicy.SILENT) {
            boolean won = claimed.compareAndSet(false, true);
            if (won) {
                LOGGER.debug("Invocation {} cancelled silently", invocationId);
            }
            return won;
        }

        CancellationException cause = new CancellationException(WebServiceErrorMessages.CANCELLED);
        return dispatch(null, new WebServiceTransportException(WebServiceErrorMessages.CANCELLED, cause));
    }

    private boolean dispatch(@Nullable T result, @Nullable WebServiceException error) {
        if (!claimed.compareAndSet(false, true)) {
            LOGGER.debug("Invocation {} already completed, dropping late result", invocationId);
            return false;
        }

        try {
            dispatchExecutor.execute(() -> {
                try {
                    resultHandler.execute(result, error);
                } catch (RuntimeException e) {
                    LOGGER.error("Result handler of invocation {} threw", invocationId, e);
                }
            });
        } catch (RejectedExecutionException e) {
            LOGGER.error("Dispatch executor rejected the result of invocation {}", invocationId, e);
        }
        return true;
    }
}
