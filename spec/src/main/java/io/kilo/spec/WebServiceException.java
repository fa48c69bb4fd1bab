package io.kilo.spec;

/**
 * Base exception for every failed web service call.
 * <p>
 * Exactly one of the subclasses is delivered to the result handler when a call does not
 * succeed:
 * <ul>
 *   <li>{@link WebServiceEncodingException} - the arguments could not be encoded</li>
 *   <li>{@link WebServiceTransportException} - connectivity, timeout or cancellation</li>
 *   <li>{@link WebServiceHttpException} - the server answered with a non-2xx status</li>
 *   <li>{@link WebServiceDecodingException} - a 2xx response could not be decoded</li>
 * </ul>
 */
public class WebServiceException extends Exception {

    public WebServiceException() {
    }

    public WebServiceException(String message) {
        super(message);
    }

    public WebServiceException(Throwable cause) {
        super(cause);
    }

    public WebServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
