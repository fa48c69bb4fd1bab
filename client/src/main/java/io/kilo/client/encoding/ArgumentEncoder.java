package io.kilo.client.encoding;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.BitSet;
import java.util.Map;

import io.kilo.spec.ArgumentValue;
import io.kilo.spec.Arguments;
import io.kilo.spec.FileValue;
import io.kilo.spec.NullValue;
import io.kilo.spec.ScalarValue;
import io.kilo.spec.WebServiceEncodingException;
import io.kilo.spec.WebServiceErrorMessages;
import io.kilo.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes {@link Arguments} as a URL query string, a form-urlencoded body, or a
 * multipart/form-data body.
 * <p>
 * Every argument is expanded into its occurrences (one per list element, otherwise one).
 * {@link NullValue} occurrences are skipped entirely. Scalars are written as their
 * {@link ScalarValue#text() text}; timestamps therefore appear as epoch milliseconds.
 */
public class ArgumentEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArgumentEncoder.class);

    private static final String CRLF = "\r\n";
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    // RFC 3986 unreserved plus the query sub-delimiters that do not split key/value pairs.
    // '+' passes here and is escaped afterwards.
    private static final BitSet QUERY_ALLOWED = new BitSet(128);

    static {
        for (char c = 'a'; c <= 'z'; c++) {
            QUERY_ALLOWED.set(c);
        }
        for (char c = 'A'; c <= 'Z'; c++) {
            QUERY_ALLOWED.set(c);
        }
        for (char c = '0'; c <= '9'; c++) {
            QUERY_ALLOWED.set(c);
        }
        for (char c : "-._~!$'()*+,/:;?@".toCharArray()) {
            QUERY_ALLOWED.set(c);
        }
    }

    private final AttachmentReadPolicy attachmentReadPolicy;

    public ArgumentEncoder() {
        this(AttachmentReadPolicy.LENIENT);
    }

    public ArgumentEncoder(AttachmentReadPolicy attachmentReadPolicy) {
        Assert.checkNotNullParam("attachmentReadPolicy", attachmentReadPolicy);
        this.attachmentReadPolicy = attachmentReadPolicy;
    }

    public AttachmentReadPolicy getAttachmentReadPolicy() {
        return attachmentReadPolicy;
    }

    /**
     * Encodes the arguments as {@code key=value} pairs joined by {@code &}.
     *
     * @param arguments the arguments
     * @return the query string without a leading {@code ?}, empty if nothing is written
     */
    public String encodeQuery(Arguments arguments) {
        Assert.checkNotNullParam("arguments", arguments);

        StringBuilder query = new StringBuilder();
        for (Map.Entry<String, ArgumentValue> argument : arguments) {
            String key = encodeQueryComponent(argument.getKey());

            for (ArgumentValue occurrence : argument.getValue().occurrences()) {
                if (occurrence instanceof NullValue) {
                    continue;
                }

                if (query.length() > 0) {
                    query.append('&');
                }
                query.append(key).append('=').append(encodeQueryComponent(queryText(occurrence)));
            }
        }
        return query.toString();
    }

    /**
     * Encodes the arguments as an {@code application/x-www-form-urlencoded} body. The content
     * is identical to {@link #encodeQuery(Arguments)}.
     *
     * @param arguments the arguments
     * @return the body bytes
     */
    public byte[] encodeFormBody(Arguments arguments) {
        return encodeQuery(arguments).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Encodes the arguments as a {@code multipart/form-data} body.
     * <p>
     * Each occurrence becomes one part. File occurrences carry a {@code filename} and
     * {@code Content-Type: application/octet-stream}; their bytes are read here.
     *
     * @param arguments the arguments
     * @param boundary the boundary token, see {@link MultipartBoundary#generate()}
     * @return the body bytes
     * @throws WebServiceEncodingException if an attachment cannot be read and the policy is
     *         {@link AttachmentReadPolicy#STRICT}
     */
    public byte[] encodeMultipartBody(Arguments arguments, String boundary) throws WebServiceEncodingException {
        Assert.checkNotNullParam("arguments", arguments);
        Assert.checkNotBlankParam("boundary", boundary);

        ByteArrayOutputStream body = new ByteArrayOutputStream();
        for (Map.Entry<String, ArgumentValue> argument : arguments) {
            String key = argument.getKey();

            for (ArgumentValue occurrence : argument.getValue().occurrences()) {
                if (occurrence instanceof NullValue) {
                    continue;
                }

                write(body, "--" + boundary + CRLF);
                write(body, "Content-Disposition: form-data; name=\"" + escapeQuotedString(key) + "\"");

                if (occurrence instanceof FileValue file) {
                    write(body, "; filename=\"" + escapeQuotedString(file.name()) + "\"" + CRLF);
                    write(body, "Content-Type: application/octet-stream" + CRLF + CRLF);
                    body.writeBytes(readAttachment(key, file));
                } else {
                    write(body, CRLF + CRLF);
                    write(body, ((ScalarValue) occurrence).text());
                }

                write(body, CRLF);
            }
        }
        write(body, "--" + boundary + "--" + CRLF);

        return body.toByteArray();
    }

    private byte[] readAttachment(String key, FileValue file) throws WebServiceEncodingException {
        try {
            return file.source().read();
        } catch (IOException e) {
            String message = String.format(WebServiceErrorMessages.ATTACHMENT_UNREADABLE, file.name(), key);
            if (attachmentReadPolicy == AttachmentReadPolicy.STRICT) {
                throw new WebServiceEncodingException(message, e);
            }
            LOGGER.warn("{}, sending an empty part: {}", message, e.getMessage());
            return new byte[0];
        }
    }

    private static String queryText(ArgumentValue occurrence) {
        if (occurrence instanceof FileValue file) {
            return file.name();
        }
        return ((ScalarValue) occurrence).text();
    }

    /**
     * Percent-encodes a key or value for a URL query component, then escapes literal
     * {@code +} as {@code %2B} so servers cannot read it as a space.
     *
     * @param value the raw text
     * @return the encoded text
     */
    public static String encodeQueryComponent(String value) {
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);

        StringBuilder encoded = new StringBuilder(bytes.length);
        for (byte b : bytes) {
            int c = b & 0xFF;
            if (c < 128 && QUERY_ALLOWED.get(c)) {
                encoded.append((char) c);
            } else {
                encoded.append('%').append(HEX[c >> 4]).append(HEX[c & 0x0F]);
            }
        }
        return encoded.toString().replace("+", "%2B");
    }

    private static String escapeQuotedString(String value) {
        return value.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
    }

    private static void write(ByteArrayOutputStream out, String text) {
        out.writeBytes(text.getBytes(StandardCharsets.UTF_8));
    }
}
