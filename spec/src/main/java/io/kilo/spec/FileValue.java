package io.kilo.spec;

import io.kilo.util.Assert;

/**
 * A file attachment.
 * <p>
 * In a multipart body the file becomes a part carrying {@code filename="name"} and
 * {@code Content-Type: application/octet-stream}; its bytes are read from {@code source}
 * when the body is encoded. Query strings and form bodies carry only the name.
 *
 * @param source supplies the file content
 * @param name the file name presented to the server
 */
public record FileValue(ByteSource source, String name) implements ArgumentValue {

    public FileValue {
        Assert.checkNotNullParam("source", source);
        Assert.checkNotNullParam("name", name);
    }

    @Override
    public Kind kind() {
        return Kind.FILE;
    }
}
