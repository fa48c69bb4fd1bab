package io.kilo.client.http.jdk;

import io.kilo.client.http.HttpClient;
import io.kilo.client.http.HttpResponse;

import java.net.*;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

import org.jspecify.annotations.Nullable;

class JdkHttpClient implements HttpClient {

    private final java.net.http.HttpClient httpClient;
    private final String baseUrl;
    private final @Nullable Duration requestTimeout;

    JdkHttpClient(String baseUrl) {
        this(baseUrl, java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(java.net.http.HttpClient.Redirect.NORMAL)
                .build(), null);
    }

    JdkHttpClient(String baseUrl, java.net.http.HttpClient httpClient, @Nullable Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;

        URL targetUrl = buildUrl(baseUrl);
        this.baseUrl = targetUrl.getProtocol() + "://" + targetUrl.getAuthority();
    }

    String getBaseUrl() {
        return baseUrl;
    }

    private static final URLStreamHandler URL_HANDLER = new URLStreamHandler() {
        protected URLConnection openConnection(URL u) {
            return null;
        }
    };

    private static URL buildUrl(String uri) {
        try {
            return new URL(null, uri, URL_HANDLER);
        } catch (MalformedURLException var2) {
            throw new IllegalArgumentException("URI [" + uri + "] is not valid");
        }
    }

    @Override
    public GetRequestBuilder get(String path) {
        return new JdkGetRequestBuilder(path);
    }

    @Override
    public PostRequestBuilder post(String path) {
        return new JdkPostRequestBuilder(path);
    }

    @Override
    public PutRequestBuilder put(String path) {
        return new JdkPutRequestBuilder(path);
    }

    @Override
    public PatchRequestBuilder patch(String path) {
        return new JdkPatchRequestBuilder(path);
    }

    @Override
    public DeleteRequestBuilder delete(String path) {
        return new JdkDeleteRequestBuilder(path);
    }

    private abstract class JdkRequestBuilder<T extends RequestBuilder<T>> implements RequestBuilder<T> {
        private final String method;
        private final String path;
        protected final Map<String, String> headers = new LinkedHashMap<>();
        protected byte @Nullable [] body;

        public JdkRequestBuilder(String method, String path) {
            this.method = method;
            this.path = path;
        }

        @Override
        public T addHeader(String name, String value) {
            headers.put(name, value);
            return self();
        }

        @Override
        public T addHeaders(Map<String, String> headers) {
            if (headers != null && !headers.isEmpty()) {
                for (Map.Entry<String, String> entry : headers.entrySet()) {
                    addHeader(entry.getKey(), entry.getValue());
                }
            }
            return self();
        }

        @Override
        public T body(byte @Nullable [] body) {
            this.body = body;
            return self();
        }

        @SuppressWarnings("unchecked")
        T self() {
            return (T) this;
        }

        protected HttpRequest createRequest() {
            HttpRequest.Builder builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path));
            if (requestTimeout != null) {
                builder.timeout(requestTimeout);
            }
            for (Map.Entry<String, String> headerEntry : headers.entrySet()) {
                builder.header(headerEntry.getKey(), headerEntry.getValue());
            }
            BodyPublisher publisher = body != null ? BodyPublishers.ofByteArray(body) : BodyPublishers.noBody();
            return builder.method(method, publisher).build();
        }

        @Override
        public CompletableFuture<HttpResponse> send() {
            HttpRequest request = createRequest();

            CompletableFuture<java.net.http.HttpResponse<byte[]>> exchange =
                    httpClient.sendAsync(request, BodyHandlers.ofByteArray());
            CompletableFuture<HttpResponse> response = exchange.thenApply(JdkHttpResponse::new);
            // Cancelling the dependent stage does not reach the exchange on its own
            response.whenComplete((ignored, throwable) -> {
                if (throwable instanceof CancellationException) {
                    exchange.cancel(true);
                }
            });
            return response;
        }
    }

    private class JdkGetRequestBuilder extends JdkRequestBuilder<GetRequestBuilder> implements GetRequestBuilder {

        public JdkGetRequestBuilder(String path) {
            super("GET", path);
        }
    }

    private class JdkPostRequestBuilder extends JdkRequestBuilder<PostRequestBuilder> implements PostRequestBuilder {

        public JdkPostRequestBuilder(String path) {
            super("POST", path);
        }
    }

    private class JdkPutRequestBuilder extends JdkRequestBuilder<PutRequestBuilder> implements PutRequestBuilder {

        public JdkPutRequestBuilder(String path) {
            super("PUT", path);
        }
    }

    private class JdkPatchRequestBuilder extends JdkRequestBuilder<PatchRequestBuilder> implements PatchRequestBuilder {

        public JdkPatchRequestBuilder(String path) {
            super("PATCH", path);
        }
    }

    private class JdkDeleteRequestBuilder extends JdkRequestBuilder<DeleteRequestBuilder> implements DeleteRequestBuilder {

        public JdkDeleteRequestBuilder(String path) {
            super("DELETE", path);
        }
    }

    private record JdkHttpResponse(java.net.http.HttpResponse<byte[]> response) implements HttpResponse {

        @Override
        public int statusCode() {
            return response.statusCode();
        }

        @Override
        public @Nullable String contentType() {
            return response.headers().firstValue("Content-Type").orElse(null);
        }

        @Override
        public Map<String, List<String>> headers() {
            return response.headers().map();
        }

        @Override
        public byte[] body() {
            byte[] body = response.body();
            return body != null ? body : new byte[0];
        }
    }
}
