package io.kilo.client;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;

import io.kilo.client.dispatch.CancellationPolicy;
import io.kilo.client.encoding.AttachmentReadPolicy;
import io.kilo.client.http.HttpClientBuilder;
import io.kilo.spec.Encoding;
import io.kilo.util.Assert;
import org.jspecify.annotations.Nullable;

public class WebServiceProxyConfigBuilder {

    private HttpClientBuilder httpClientBuilder = HttpClientBuilder.DEFAULT_FACTORY;
    private @Nullable Executor dispatchExecutor;
    private Encoding encoding = Encoding.APPLICATION_X_WWW_FORM_URLENCODED;
    private final Map<String, String> defaultHeaders = new LinkedHashMap<>();
    private CancellationPolicy cancellationPolicy = CancellationPolicy.DELIVER_FAILURE;
    private AttachmentReadPolicy attachmentReadPolicy = AttachmentReadPolicy.LENIENT;

    public WebServiceProxyConfigBuilder httpClientBuilder(HttpClientBuilder httpClientBuilder) {
        Assert.checkNotNullParam("httpClientBuilder", httpClientBuilder);
        this.httpClientBuilder = httpClientBuilder;
        return this;
    }

    /**
     * Sets the executor result handlers run on. It should be serial, e.g. a UI event queue or
     * a single-thread executor; the proxy does not shut it down.
     */
    public WebServiceProxyConfigBuilder dispatchExecutor(Executor dispatchExecutor) {
        Assert.checkNotNullParam("dispatchExecutor", dispatchExecutor);
        this.dispatchExecutor = dispatchExecutor;
        return this;
    }

    public WebServiceProxyConfigBuilder encoding(Encoding encoding) {
        Assert.checkNotNullParam("encoding", encoding);
        this.encoding = encoding;
        return this;
    }

    public WebServiceProxyConfigBuilder addHeader(String name, String value) {
        Assert.checkNotNullParam("name", name);
        Assert.checkNotNullParam("value", value);
        this.defaultHeaders.put(name, value);
        return this;
    }

    public WebServiceProxyConfigBuilder addHeaders(Map<String, String> headers) {
        Assert.checkNotNullParam("headers", headers);
        for (Map.Entry<String, String> entry : headers.entrySet()) {
            addHeader(entry.getKey(), entry.getValue());
        }
        return this;
    }

    public WebServiceProxyConfigBuilder cancellationPolicy(CancellationPolicy cancellationPolicy) {
        Assert.checkNotNullParam("cancellationPolicy", cancellationPolicy);
        this.cancellationPolicy = cancellationPolicy;
        return this;
    }

    public WebServiceProxyConfigBuilder attachmentReadPolicy(AttachmentReadPolicy attachmentReadPolicy) {
        Assert.checkNotNullParam("attachmentReadPolicy", attachmentReadPolicy);
        this.attachmentReadPolicy = attachmentReadPolicy;
        return this;
    }

    public WebServiceProxyConfig build() {
        return new WebServiceProxyConfig(httpClientBuilder, dispatchExecutor, encoding, defaultHeaders,
                cancellationPolicy, attachmentReadPolicy);
    }
}
