package io.kilo.client.request;

import java.net.URI;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Supplier;

import io.kilo.client.encoding.ArgumentEncoder;
import io.kilo.client.encoding.MultipartBoundary;
import io.kilo.spec.Arguments;
import io.kilo.spec.Encoding;
import io.kilo.spec.HttpMethod;
import io.kilo.spec.WebServiceEncodingException;
import io.kilo.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Decides where the arguments of a call go and builds the {@link RequestDescriptor}.
 * <p>
 * Arguments go into the query string unless the method is {@code POST} and no explicit content
 * is supplied. In that case they are encoded into the body with the proxy's {@link Encoding},
 * and the assembler sets the {@code Content-Type} header over any caller value.
 */
public class RequestAssembler {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String APPLICATION_OCTET_STREAM = "application/octet-stream";

    private final ArgumentEncoder encoder;
    private final Supplier<String> boundaryGenerator;

    public RequestAssembler(ArgumentEncoder encoder) {
        this(encoder, MultipartBoundary::generate);
    }

    RequestAssembler(ArgumentEncoder encoder, Supplier<String> boundaryGenerator) {
        this.encoder = Assert.checkNotNullParam("encoder", encoder);
        this.boundaryGenerator = Assert.checkNotNullParam("boundaryGenerator", boundaryGenerator);
    }

    /**
     * Builds a request.
     *
     * @param method the HTTP method
     * @param path the path, resolved against {@code serverUri}
     * @param arguments the call arguments
     * @param content explicit body content, or {@code null}
     * @param encoding the body encoding for {@code POST} arguments
     * @param serverUri the absolute server URI
     * @param headers caller headers
     * @return the request
     * @throws WebServiceEncodingException if the multipart body cannot be encoded
     * @throws IllegalArgumentException if the path does not form a valid URI on the server
     */
    public RequestDescriptor buildRequest(HttpMethod method, String path, Arguments arguments,
                                          @Nullable RequestContent content, Encoding encoding,
                                          URI serverUri, Map<String, String> headers) throws WebServiceEncodingException {
        Assert.checkNotNullParam("method", method);
        Assert.checkNotNullParam("path", path);
        Assert.checkNotNullParam("arguments", arguments);
        Assert.checkNotNullParam("encoding", encoding);
        Assert.checkNotNullParam("serverUri", serverUri);
        Assert.checkNotNullParam("headers", headers);

        boolean argumentsInQuery = method != HttpMethod.POST || content != null;
        String query = argumentsInQuery ? encoder.encodeQuery(arguments) : "";

        URI uri = resolve(serverUri, path, query);

        Map<String, String> requestHeaders = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        requestHeaders.putAll(headers);

        byte[] body;
        String contentType;
        if (content != null) {
            body = content.bytes();
            contentType = content.contentType() != null
                    ? content.contentType()
                    : requestHeaders.getOrDefault(CONTENT_TYPE, APPLICATION_OCTET_STREAM);
            requestHeaders.put(CONTENT_TYPE, contentType);
        } else if (method == HttpMethod.POST) {
            switch (encoding) {
                case APPLICATION_X_WWW_FORM_URLENCODED -> {
                    contentType = encoding.mediaType();
                    body = encoder.encodeFormBody(arguments);
                }
                case MULTIPART_FORM_DATA -> {
                    String boundary = boundaryGenerator.get();
                    contentType = encoding.mediaType() + "; boundary=" + boundary;
                    body = encoder.encodeMultipartBody(arguments, boundary);
                }
                default -> throw new IllegalStateException("Unsupported encoding: " + encoding);
            }
            requestHeaders.put(CONTENT_TYPE, contentType);
        } else {
            body = null;
            contentType = null;
        }

        return new RequestDescriptor(method, uri, Collections.unmodifiableMap(requestHeaders), body, contentType);
    }

    private static URI resolve(URI serverUri, String path, String query) {
        URI uri = serverUri.resolve(query.isEmpty() ? path : path + "?" + query);

        if (!Objects.equals(uri.getScheme(), serverUri.getScheme())
                || !Objects.equals(uri.getRawAuthority(), serverUri.getRawAuthority())) {
            throw new IllegalArgumentException("Path [" + path + "] does not resolve to server " + serverUri);
        }
        return uri;
    }
}
