package io.kilo.client.http;

import io.kilo.client.http.jdk.JdkHttpClientBuilder;

/**
 * Creates the {@link HttpClient} a web service proxy sends its requests through.
 * <p>
 * Alternative transports plug in here; the proxy only needs the per-method request builders
 * and a cancellable {@code send()}.
 */
public interface HttpClientBuilder {

    /**
     * The {@code java.net.http} transport with HTTP/1.1, normal redirects and no timeouts.
     */
    HttpClientBuilder DEFAULT_FACTORY = new JdkHttpClientBuilder();

    /**
     * Creates a client bound to the scheme and authority of a URL. Any path in the URL is
     * ignored; request builders receive absolute paths.
     *
     * @param url the server URL
     * @return the client
     * @throws IllegalArgumentException if the URL is malformed
     */
    HttpClient create(String url);
}
