package io.kilo.client.encoding;

/**
 * What a multipart encoder does when an attachment's bytes cannot be read.
 */
public enum AttachmentReadPolicy {

    /** Write the part with an empty body and log a warning. */
    LENIENT,

    /** Fail the whole call with a {@link io.kilo.spec.WebServiceEncodingException}. */
    STRICT
}
