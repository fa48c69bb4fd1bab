package io.kilo.client;

import java.util.Map;
import java.util.concurrent.Executor;

import io.kilo.client.dispatch.CancellationPolicy;
import io.kilo.client.encoding.AttachmentReadPolicy;
import io.kilo.client.http.HttpClientBuilder;
import io.kilo.spec.Encoding;
import io.kilo.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Settings of a {@link WebServiceProxy}.
 *
 * @see WebServiceProxyConfigBuilder
 */
public class WebServiceProxyConfig {

    private final HttpClientBuilder httpClientBuilder;
    private final @Nullable Executor dispatchExecutor;
    private final Encoding encoding;
    private final Map<String, String> defaultHeaders;
    private final CancellationPolicy cancellationPolicy;
    private final AttachmentReadPolicy attachmentReadPolicy;

    public WebServiceProxyConfig() {
        this(HttpClientBuilder.DEFAULT_FACTORY, null, Encoding.APPLICATION_X_WWW_FORM_URLENCODED, Map.of(),
                CancellationPolicy.DELIVER_FAILURE, AttachmentReadPolicy.LENIENT);
    }

    public WebServiceProxyConfig(HttpClientBuilder httpClientBuilder, @Nullable Executor dispatchExecutor,
                                 Encoding encoding, Map<String, String> defaultHeaders,
                                 CancellationPolicy cancellationPolicy, AttachmentReadPolicy attachmentReadPolicy) {
        this.httpClientBuilder = Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        this.dispatchExecutor = dispatchExecutor;
        this.encoding = Assert.checkNotNullParam("encoding", encoding);
        this.defaultHeaders = Map.copyOf(Assert.checkNotNullParam("defaultHeaders", defaultHeaders));
        this.cancellationPolicy = Assert.checkNotNullParam("cancellationPolicy", cancellationPolicy);
        this.attachmentReadPolicy = Assert.checkNotNullParam("attachmentReadPolicy", attachmentReadPolicy);
    }

    public HttpClientBuilder getHttpClientBuilder() {
        return httpClientBuilder;
    }

    /**
     * Returns the executor result handlers run on.
     *
     * @return the executor, or {@code null} to let the proxy own a single-thread executor
     */
    public @Nullable Executor getDispatchExecutor() {
        return dispatchExecutor;
    }

    public Encoding getEncoding() {
        return encoding;
    }

    public Map<String, String> getDefaultHeaders() {
        return defaultHeaders;
    }

    public CancellationPolicy getCancellationPolicy() {
        return cancellationPolicy;
    }

    public AttachmentReadPolicy getAttachmentReadPolicy() {
        return attachmentReadPolicy;
    }
}
