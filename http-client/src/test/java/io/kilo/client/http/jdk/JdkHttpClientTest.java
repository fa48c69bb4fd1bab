package io.kilo.client.http.jdk;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.junit.jupiter.api.Assertions.*;

import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import io.kilo.client.http.HttpClient;
import io.kilo.client.http.HttpResponse;
import io.kilo.spec.HttpMethod;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class JdkHttpClientTest {

    private WireMockServer server;

    @BeforeEach
    public void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();

        configureFor("localhost", server.port());
    }

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop();
        }
    }

    private String getServerUrl() {
        return "http://localhost:" + server.port();
    }

    @Test
    public void testBaseUrlNormalization() {
        String baseUrl = "http://localhost:8080";

        JdkHttpClient client = new JdkHttpClient(baseUrl);
        Assertions.assertEquals(baseUrl, client.getBaseUrl());

        baseUrl = "http://localhost";
        client = new JdkHttpClient(baseUrl);
        Assertions.assertEquals("http://localhost", client.getBaseUrl());

        baseUrl = "https://localhost:443";
        client = new JdkHttpClient(baseUrl);
        Assertions.assertEquals("https://localhost:443", client.getBaseUrl());

        baseUrl = "https://localhost:80/httprpc-test/";
        client = new JdkHttpClient(baseUrl);
        Assertions.assertEquals("https://localhost:80", client.getBaseUrl());
    }

    @Test
    public void testInvalidBaseUrl() {
        assertThrows(IllegalArgumentException.class, () -> new JdkHttpClient("this_is_invalid"));
    }

    @Test
    public void testGetWithQueryReturnsBodyAndHeaders() throws Exception {
        givenThat(get(urlEqualTo("/test?a=1&b=2"))
                .willReturn(okForContentType("application/json", "{\"ok\":true}")
                        .withHeader("X-Test", "yes")));

        HttpResponse response = HttpClient.createHttpClient(getServerUrl())
                .get("/test?a=1&b=2")
                .addHeader("Accept", "application/json")
                .send()
                .get(5, TimeUnit.SECONDS);

        assertTrue(response.success());
        assertEquals(200, response.statusCode());
        assertEquals("application/json", response.contentType());
        assertEquals("{\"ok\":true}", response.bodyAsString());
        assertEquals("yes", response.headers().get("X-Test").get(0));

        verify(getRequestedFor(urlEqualTo("/test?a=1&b=2"))
                .withHeader("Accept", equalTo("application/json")));
    }

    @Test
    public void testEveryMethodSendsItsBody() throws Exception {
        HttpClient client = new JdkHttpClientBuilder().create(getServerUrl());

        for (HttpMethod method : HttpMethod.values()) {
            server.resetAll();
            givenThat(any(urlEqualTo("/echo")).willReturn(aResponse().withStatus(204)));

            HttpResponse response = client.request(method, "/echo")
                    .addHeader("Content-Type", "text/plain")
                    .body("payload".getBytes(StandardCharsets.UTF_8))
                    .send()
                    .get(5, TimeUnit.SECONDS);

            assertEquals(204, response.statusCode(), method.asString());
            assertEquals(0, response.body().length);
            verify(1, anyRequestedFor(urlEqualTo("/echo")).withRequestBody(equalTo("payload")));
            assertEquals(method.asString(), server.getAllServeEvents().get(0).getRequest().getMethod().getName());
        }
    }

    @Test
    public void testErrorStatusIsNotAnException() throws Exception {
        givenThat(delete(urlEqualTo("/missing"))
                .willReturn(aResponse().withStatus(404).withHeader("Content-Type", "text/plain").withBody("gone")));

        HttpResponse response = HttpClient.createHttpClient(getServerUrl())
                .delete("/missing")
                .send()
                .get(5, TimeUnit.SECONDS);

        assertFalse(response.success());
        assertEquals(404, response.statusCode());
        assertEquals("gone", response.bodyAsString());
    }

    @Test
    public void testRequestTimeout() {
        givenThat(get(urlEqualTo("/slow")).willReturn(ok().withFixedDelay(2000)));

        HttpClient client = new JdkHttpClientBuilder()
                .requestTimeout(Duration.ofMillis(200))
                .create(getServerUrl());

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> client.get("/slow").send().get(5, TimeUnit.SECONDS));
        assertInstanceOf(HttpTimeoutException.class, e.getCause());
    }

    @Test
    public void testCancelCompletesFuture() {
        givenThat(get(urlEqualTo("/slow")).willReturn(ok().withFixedDelay(2000)));

        CompletableFuture<HttpResponse> future = HttpClient.createHttpClient(getServerUrl())
                .get("/slow")
                .send();
        assertTrue(future.cancel(true));

        assertTrue(future.isCancelled());
        assertThrows(CancellationException.class, future::join);
    }
}
