package io.kilo.spec;

import java.time.Instant;

/**
 * A point in time, written as the integer number of milliseconds since the epoch.
 *
 * @param epochMillis milliseconds since 1970-01-01T00:00:00Z
 */
public record TimestampValue(long epochMillis) implements ArgumentValue, ScalarValue {

    @Override
    public Kind kind() {
        return Kind.TIMESTAMP;
    }

    @Override
    public String text() {
        return Long.toString(epochMillis);
    }

    public Instant toInstant() {
        return Instant.ofEpochMilli(epochMillis);
    }
}
