package io.kilo.client.response;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import io.kilo.client.http.HttpResponse;
import io.kilo.util.Assert;
import org.eclipse.jetty.http.HttpStatus;
import org.jspecify.annotations.Nullable;

/**
 * Classifies transport results into {@link ResponseOutcome}s.
 * <p>
 * A 2xx status is a {@link ResponseOutcome.Success}. Anything else is a
 * {@link ResponseOutcome.HttpError} whose message is the decoded body when the server sent
 * {@code text/*}, otherwise the standard reason phrase of the status, e.g. {@code "Forbidden"}.
 */
public class ResponseClassifier {

    private static final String TEXT_PREFIX = "text/";

    public ResponseOutcome classify(HttpResponse response) {
        Assert.checkNotNullParam("response", response);
        return classify(response.statusCode(), response.contentType(), response.headers(), response.body());
    }

    public ResponseOutcome classify(int statusCode, @Nullable String contentType,
                                    Map<String, List<String>> headers, byte[] body) {
        if (HttpStatus.isSuccess(statusCode)) {
            return new ResponseOutcome.Success(body, contentType, headers);
        }

        String message = null;
        if (isText(contentType) && body.length > 0) {
            message = new String(body, StandardCharsets.UTF_8);
        }
        if (message == null) {
            message = reasonPhrase(statusCode);
        }
        return new ResponseOutcome.HttpError(statusCode, message);
    }

    /**
     * Wraps a failed exchange, unwrapping the {@link CompletionException} or
     * {@link ExecutionException} added by the future chain.
     *
     * @param throwable the failure
     * @return the outcome
     */
    public ResponseOutcome classifyFailure(Throwable throwable) {
        Assert.checkNotNullParam("throwable", throwable);

        Throwable cause = throwable;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return new ResponseOutcome.TransportError(cause);
    }

    /**
     * Returns the standard reason phrase of a status code.
     *
     * @param statusCode the status code
     * @return the phrase, or {@code null} if the code is unknown
     */
    public static @Nullable String reasonPhrase(int statusCode) {
        if (statusCode < 0) {
            return null;
        }
        HttpStatus.Code code = HttpStatus.getCode(statusCode);
        return code != null ? code.getMessage() : null;
    }

    private static boolean isText(@Nullable String contentType) {
        return contentType != null && contentType.trim().toLowerCase(Locale.ROOT).startsWith(TEXT_PREFIX);
    }
}
