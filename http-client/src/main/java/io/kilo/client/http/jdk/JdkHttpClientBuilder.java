package io.kilo.client.http.jdk;

import io.kilo.client.http.HttpClient;
import io.kilo.client.http.HttpClientBuilder;

import java.time.Duration;
import java.util.concurrent.Executor;

import io.kilo.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Creates {@link HttpClient}s backed by {@code java.net.http.HttpClient}.
 * <p>
 * Timeouts and redirect handling are transport settings; the proxy never retries.
 */
public class JdkHttpClientBuilder implements HttpClientBuilder {

    private @Nullable Duration connectTimeout;
    private @Nullable Duration requestTimeout;
    private boolean followRedirects = true;
    private @Nullable Executor executor;

    public JdkHttpClientBuilder connectTimeout(Duration connectTimeout) {
        Assert.checkNotNullParam("connectTimeout", connectTimeout);
        this.connectTimeout = connectTimeout;
        return this;
    }

    /**
     * Sets the time allowed for a whole exchange. An exchange that exceeds it fails with
     * {@link java.net.http.HttpTimeoutException}.
     */
    public JdkHttpClientBuilder requestTimeout(Duration requestTimeout) {
        Assert.checkNotNullParam("requestTimeout", requestTimeout);
        this.requestTimeout = requestTimeout;
        return this;
    }

    public JdkHttpClientBuilder followRedirects(boolean followRedirects) {
        this.followRedirects = followRedirects;
        return this;
    }

    public JdkHttpClientBuilder executor(Executor executor) {
        Assert.checkNotNullParam("executor", executor);
        this.executor = executor;
        return this;
    }

    @Override
    public HttpClient create(String url) {
        java.net.http.HttpClient.Builder builder = java.net.http.HttpClient.newBuilder()
                .version(java.net.http.HttpClient.Version.HTTP_1_1)
                .followRedirects(followRedirects
                        ? java.net.http.HttpClient.Redirect.NORMAL
                        : java.net.http.HttpClient.Redirect.NEVER);
        if (connectTimeout != null) {
            builder.connectTimeout(connectTimeout);
        }
        if (executor != null) {
            builder.executor(executor);
        }
        return new JdkHttpClient(url, builder.build(), requestTimeout);
    }
}
