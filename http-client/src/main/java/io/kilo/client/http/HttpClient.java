package io.kilo.client.http;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import io.kilo.spec.HttpMethod;
import org.jspecify.annotations.Nullable;

/**
 * Asynchronous HTTP transport used by the web service proxy.
 * <p>
 * A client is bound to a base URL ({@code scheme://authority}); every request builder takes the
 * path and raw query relative to it. Sending never blocks the caller: the returned future
 * completes on a transport thread with the response, or exceptionally when no response was
 * received. Cancelling the future cancels the exchange.
 */
public interface HttpClient {

    static HttpClient createHttpClient(String baseUrl) {
        return HttpClientBuilder.DEFAULT_FACTORY.create(baseUrl);
    }

    GetRequestBuilder get(String path);

    PostRequestBuilder post(String path);

    PutRequestBuilder put(String path);

    PatchRequestBuilder patch(String path);

    DeleteRequestBuilder delete(String path);

    default RequestBuilder<?> request(HttpMethod method, String path) {
        return switch (method) {
            case GET -> get(path);
            case POST -> post(path);
            case PUT -> put(path);
            case PATCH -> patch(path);
            case DELETE -> delete(path);
        };
    }

    interface RequestBuilder<T extends RequestBuilder<T>> {
        CompletableFuture<HttpResponse> send();

        T addHeader(String name, String value);

        T addHeaders(Map<String, String> headers);

        T body(byte @Nullable [] body);
    }

    interface GetRequestBuilder extends RequestBuilder<GetRequestBuilder> {

    }

    interface PostRequestBuilder extends RequestBuilder<PostRequestBuilder> {

    }

    interface PutRequestBuilder extends RequestBuilder<PutRequestBuilder> {

    }

    interface PatchRequestBuilder extends RequestBuilder<PatchRequestBuilder> {

    }

    interface DeleteRequestBuilder extends RequestBuilder<DeleteRequestBuilder> {

    }
}
