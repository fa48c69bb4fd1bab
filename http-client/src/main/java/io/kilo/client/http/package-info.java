/**
 * HTTP transport abstraction for web service invocations.
 *
 * <p>This package provides a pluggable asynchronous HTTP client. The web service proxy only
 * talks to the transport through these interfaces; connections, TLS, redirects and timeouts
 * are the implementation's business.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.kilo.client.http.HttpClient} - request builders per HTTP method</li>
 *   <li>{@link io.kilo.client.http.HttpClientBuilder} - factory binding a client to a base URL</li>
 *   <li>{@link io.kilo.client.http.HttpResponse} - status, content type, headers and body</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * HttpClient client = HttpClient.createHttpClient("http://localhost:8080");
 *
 * client.put("/test?id=1")
 *     .addHeader("Content-Type", "application/json")
 *     .body("{\"name\":\"héllo\"}".getBytes(StandardCharsets.UTF_8))
 *     .send()
 *     .thenAccept(response -> System.out.println(response.statusCode()));
 * }</pre>
 *
 * @see io.kilo.client.http.jdk.JdkHttpClientBuilder
 */
@NullMarked
package io.kilo.client.http;

import org.jspecify.annotations.NullMarked;
