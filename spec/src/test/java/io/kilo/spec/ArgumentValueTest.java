package io.kilo.spec;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Date;
import java.util.List;

import org.junit.jupiter.api.Test;

public class ArgumentValueTest {

    @Test
    public void testScalarText() {
        assertEquals("héllo", ((ScalarValue) ArgumentValue.of("héllo")).text());
        assertEquals("123", ((ScalarValue) ArgumentValue.of(123)).text());
        assertEquals("1.5", ((ScalarValue) ArgumentValue.of(1.5d)).text());
        assertEquals("12345678901234567890", ((ScalarValue) ArgumentValue.of(new BigDecimal("1.234567890123456789E+19"))).text());
        assertEquals("true", ((ScalarValue) ArgumentValue.of(true)).text());
        assertEquals("false", ((ScalarValue) ArgumentValue.of(false)).text());
    }

    @Test
    public void testTimestampIsEpochMillis() {
        Instant now = Instant.ofEpochMilli(1_600_000_000_123L);

        assertEquals("1600000000123", ((ScalarValue) ArgumentValue.of(now)).text());
        assertEquals("1600000000123", ((ScalarValue) ArgumentValue.of(Date.from(now))).text());
        assertEquals(new TimestampValue(1_600_000_000_123L), ArgumentValue.from(now));
        assertEquals(now, ((TimestampValue) ArgumentValue.ofEpochMillis(1_600_000_000_123L)).toInstant());
    }

    @Test
    public void testNullsBecomeNullValue() {
        assertSame(NullValue.INSTANCE, ArgumentValue.of((String) null));
        assertSame(NullValue.INSTANCE, ArgumentValue.of((Number) null));
        assertSame(NullValue.INSTANCE, ArgumentValue.from(null));
        assertEquals(ArgumentValue.Kind.NULL, ArgumentValue.ofNull().kind());
    }

    @Test
    public void testListOccurrencesPreserveOrder() {
        ArgumentValue list = ArgumentValue.list("a", "b", "c");

        assertEquals(ArgumentValue.Kind.LIST, list.kind());
        assertEquals(List.of(new StringValue("a"), new StringValue("b"), new StringValue("c")), list.occurrences());
    }

    @Test
    public void testListFromCollection() {
        List<ArgumentValue> expected = List.of(new StringValue("a"), new StringValue("b"), new StringValue("c"));

        assertEquals(expected, ArgumentValue.list(List.of("a", "b", "c")).occurrences());
        assertEquals(expected, ArgumentValue.list(List.of(new StringValue("a"), new StringValue("b"), new StringValue("c"))).occurrences());
        assertEquals(expected, ArgumentValue.list(expected).occurrences());
        assertEquals(List.of(), ArgumentValue.list(List.of()).occurrences());
    }

    @Test
    public void testScalarHasSingleOccurrence() {
        ArgumentValue value = ArgumentValue.of(42);
        assertEquals(List.of(value), value.occurrences());
    }

    @Test
    public void testNestedListIsRejected() {
        ArgumentValue inner = ArgumentValue.list("a");

        assertThrows(IllegalArgumentException.class, () -> ArgumentValue.list(List.of(inner)));
        assertThrows(IllegalArgumentException.class, () -> ArgumentValue.from(List.of(List.of("a"))));
    }

    @Test
    public void testNullListElementIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ListValue(Arrays.asList(ArgumentValue.of("a"), null)));
    }

    @Test
    public void testUnsupportedTypeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> ArgumentValue.from(new Object()));
    }

    @Test
    public void testFromConvertsSupportedTypes() {
        assertEquals(new StringValue("x"), ArgumentValue.from(new StringBuilder("x")));
        assertEquals(new NumberValue(7L), ArgumentValue.from(7L));
        assertEquals(BooleanValue.TRUE, ArgumentValue.from(Boolean.TRUE));
        assertEquals(ArgumentValue.Kind.LIST, ArgumentValue.from(new String[] {"a", "b"}).kind());

        ArgumentValue file = ArgumentValue.from(Path.of("dir", "test.txt"));
        assertInstanceOf(FileValue.class, file);
        assertEquals("test.txt", ((FileValue) file).name());
    }

    @Test
    public void testWrappedByteSourceIsCopied() throws Exception {
        byte[] bytes = {1, 2, 3};
        ByteSource source = ByteSource.wrap(bytes);
        bytes[0] = 9;

        assertArrayEquals(new byte[] {1, 2, 3}, source.read());
    }
}
