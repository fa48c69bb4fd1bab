/**
 * Web service invocation proxy.
 *
 * <p>The proxy turns an HTTP method, a path and named {@link io.kilo.spec.Arguments} into an
 * encoded request, executes it asynchronously through an {@link io.kilo.client.http.HttpClient},
 * classifies the response and delivers the result to a {@link io.kilo.client.ResultHandler}.
 *
 * <h2>Pipeline</h2>
 * <pre>
 * invoke(method, path, arguments, content)
 *     ↓
 * RequestAssembler (query string or form / multipart body)
 *     ↓
 * HttpClient (transport thread)
 *     ↓
 * ResponseClassifier (Success / HttpError / TransportError)
 *     ↓
 * ResponseHandler (decoding, still on the transport thread)
 *     ↓
 * ResultDispatcher (dispatch executor, exactly once)
 *     ↓
 * ResultHandler
 * </pre>
 *
 * @see io.kilo.client.WebServiceProxy
 */
@NullMarked
package io.kilo.client;

import org.jspecify.annotations.NullMarked;
