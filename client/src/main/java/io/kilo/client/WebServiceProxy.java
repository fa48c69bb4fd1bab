package io.kilo.client;

import java.net.URI;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

import com.fasterxml.jackson.core.type.TypeReference;
import io.kilo.client.dispatch.CancellationPolicy;
import io.kilo.client.dispatch.ResultDispatcher;
import io.kilo.client.encoding.ArgumentEncoder;
import io.kilo.client.http.HttpClient;
import io.kilo.client.http.HttpResponse;
import io.kilo.client.request.RequestAssembler;
import io.kilo.client.request.RequestContent;
import io.kilo.client.request.RequestDescriptor;
import io.kilo.client.response.ResponseClassifier;
import io.kilo.client.response.ResponseHandler;
import io.kilo.client.response.ResponseHandlers;
import io.kilo.client.response.ResponseOutcome;
import io.kilo.spec.Arguments;
import io.kilo.spec.Encoding;
import io.kilo.spec.HttpMethod;
import io.kilo.spec.WebServiceEncodingException;
import io.kilo.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Web service invocation proxy.
 * <p>
 * Turns a method, a path and named arguments into an HTTP request, executes it asynchronously,
 * classifies the response and delivers a typed result to a {@link ResultHandler} on the dispatch
 * executor. Arguments travel in the query string, except for {@code POST} requests without
 * explicit content, whose arguments are encoded in the body according to {@link #getEncoding()}.
 * <p>
 * The encoding and default headers are shared by every call made through the proxy. They are
 * meant to be set before use; changing them while calls are being assembled is not synchronised.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * WebServiceProxy proxy = new WebServiceProxy("http://localhost:8080/httprpc-test/");
 *
 * proxy.invoke(HttpMethod.GET, "test/fibonacci", Arguments.builder().put("count", 8).build(),
 *     new TypeReference<List<Integer>>() {},
 *     (result, error) -> System.out.println(error == null ? result : error.getMessage()));
 *
 * proxy.setEncoding(Encoding.MULTIPART_FORM_DATA);
 * proxy.invoke(HttpMethod.POST, "test", Arguments.builder()
 *         .put("string", "héllo")
 *         .put("attachments", List.of(Path.of("test.txt"), Path.of("test.jpg")))
 *         .build(),
 *     Response.class, (result, error) -> { ... });
 * }</pre>
 */
public class WebServiceProxy implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(WebServiceProxy.class);

    private static final String DISPATCH_THREAD_NAME = "kilo-dispatch";

    private final URI serverUri;
    private final HttpClient httpClient;
    private final Executor dispatchExecutor;
    private final @Nullable ExecutorService ownedDispatchExecutor;
    private final CancellationPolicy cancellationPolicy;
    private final RequestAssembler requestAssembler;
    private final ResponseClassifier responseClassifier = new ResponseClassifier();
    private final AtomicLong invocationIds = new AtomicLong();

    private volatile Encoding encoding;
    private volatile Map<String, String> headers;

    public WebServiceProxy(String serverUrl) {
        this(serverUrl, new WebServiceProxyConfig());
    }

    /**
     * Creates a new web service proxy.
     *
     * @param serverUrl the absolute server URL paths are resolved against, e.g.
     *                  {@code http://localhost:8080/httprpc-test/}
     * @param config the proxy settings
     * @throws IllegalArgumentException if the URL is not an absolute HTTP(S) URL
     */
    public WebServiceProxy(String serverUrl, WebServiceProxyConfig config) {
        Assert.checkNotNullParam("serverUrl", serverUrl);
        Assert.checkNotNullParam("config", config);

        this.serverUri = URI.create(serverUrl);
        String scheme = serverUri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new IllegalArgumentException("URL is not an absolute HTTP URL: [" + serverUrl + "]");
        }

        this.httpClient = config.getHttpClientBuilder().create(serverUrl);

        if (config.getDispatchExecutor() != null) {
            this.dispatchExecutor = config.getDispatchExecutor();
            this.ownedDispatchExecutor = null;
        } else {
            this.ownedDispatchExecutor = Executors.newSingleThreadExecutor(runnable -> {
                Thread thread = new Thread(runnable, DISPATCH_THREAD_NAME);
                thread.setDaemon(true);
                return thread;
            });
            this.dispatchExecutor = ownedDispatchExecutor;
        }

        this.cancellationPolicy = config.getCancellationPolicy();
        this.requestAssembler = new RequestAssembler(new ArgumentEncoder(config.getAttachmentReadPolicy()));
        this.encoding = config.getEncoding();
        this.headers = config.getDefaultHeaders();
    }

    public URI getServerUri() {
        return serverUri;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Encoding getEncoding() {
        return encoding;
    }

    /**
     * Sets the encoding used for the arguments of {@code POST} requests without explicit content.
     *
     * @param encoding the encoding
     */
    public void setEncoding(Encoding encoding) {
        Assert.checkNotNullParam("encoding", encoding);
        this.encoding = encoding;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    /**
     * Replaces the headers sent with every request. {@code Content-Type} is overridden when the
     * proxy encodes the arguments into the body.
     *
     * @param headers the headers
     */
    public void setHeaders(Map<String, String> headers) {
        Assert.checkNotNullParam("headers", headers);
        for (Map.Entry<String, String> header : headers.entrySet()) {
            Assert.checkNotNullParam("header name", header.getKey());
            Assert.checkNotNullParam("header value", header.getValue());
        }
        this.headers = Map.copyOf(headers);
    }

    public <T> Invocation invoke(HttpMethod method, String path, Arguments arguments,
                                 Class<T> type, ResultHandler<T> resultHandler) {
        return invoke(method, path, arguments, null, ResponseHandlers.json(type), resultHandler);
    }

    public <T> Invocation invoke(HttpMethod method, String path, Arguments arguments,
                                 TypeReference<T> typeReference, ResultHandler<T> resultHandler) {
        return invoke(method, path, arguments, null, ResponseHandlers.json(typeReference), resultHandler);
    }

    public <T> Invocation invoke(HttpMethod method, String path, Arguments arguments,
                                 ResponseHandler<T> responseHandler, ResultHandler<T> resultHandler) {
        return invoke(method, path, arguments, null, responseHandler, resultHandler);
    }

    public <T> Invocation invoke(HttpMethod method, String path, Arguments arguments, @Nullable RequestContent content,
                                 Class<T> type, ResultHandler<T> resultHandler) {
        return invoke(method, path, arguments, content, ResponseHandlers.json(type), resultHandler);
    }

    public <T> Invocation invoke(HttpMethod method, String path, Arguments arguments, @Nullable RequestContent content,
                                 TypeReference<T> typeReference, ResultHandler<T> resultHandler) {
        return invoke(method, path, arguments, content, ResponseHandlers.json(typeReference), resultHandler);
    }

    /**
     * Invokes a web service method.
     * <p>
     * Returns immediately. The response handler decodes successful content on a transport
     * thread; the result handler is then called exactly once on the dispatch executor.
     *
     * @param method the HTTP method
     * @param path the path, resolved against the server URL
     * @param arguments the request arguments
     * @param content explicit request content, or {@code null} for the default content
     * @param responseHandler decodes the content of a successful response
     * @param resultHandler receives the result or the error
     * @param <T> the result type
     * @return a handle that can cancel the call
     * @throws IllegalArgumentException if the path does not form a valid URL on the server
     */
    public <T> Invocation invoke(HttpMethod method, String path, Arguments arguments, @Nullable RequestContent content,
                                 ResponseHandler<T> responseHandler, ResultHandler<T> resultHandler) {
        Assert.checkNotNullParam("responseHandler", responseHandler);
        Assert.checkNotNullParam("resultHandler", resultHandler);

        long id = invocationIds.incrementAndGet();
        ResultDispatcher<T> dispatcher = new ResultDispatcher<>(id, resultHandler, dispatchExecutor);

        RequestDescriptor request;
        try {
            request = requestAssembler.buildRequest(method, path, arguments, content, encoding, serverUri, headers);
        } catch (WebServiceEncodingException e) {
            LOGGER.debug("Invocation {}: {} {} failed to encode: {}", id, method, path, e.getMessage());
            dispatcher.fail(e);
            return new Invocation(id, dispatcher, null, cancellationPolicy);
        }

        LOGGER.debug("Invocation {}: {} {}", id, method, request.uri());

        CompletableFuture<HttpResponse> exchange;
        try {
            exchange = httpClient.request(method, request.pathAndQuery())
                    .addHeaders(request.headers())
                    .body(request.body())
                    .send();
        } catch (RuntimeException e) {
            exchange = CompletableFuture.failedFuture(e);
        }

        exchange.whenComplete((response, throwable) -> {
            ResponseOutcome outcome = throwable != null
                    ? responseClassifier.classifyFailure(throwable)
                    : responseClassifier.classify(response);
            LOGGER.debug("Invocation {} completed: {}", id, outcome.getClass().getSimpleName());
            dispatcher.complete(outcome, responseHandler);
        });

        return new Invocation(id, dispatcher, exchange, cancellationPolicy);
    }

    /**
     * Shuts down the dispatch executor if the proxy created it. Results of calls still in
     * flight are no longer delivered.
     */
    @Override
    public void close() {
        if (ownedDispatchExecutor != null) {
            ownedDispatchExecutor.shutdown();
        }
    }
}
