package ember.protocol;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One unit of the RESP wire protocol. Instances are immutable; bulk payloads are
 * copied on the way in and never handed out for mutation.
 */
public final class Frame {

    public enum Type {
        SIMPLE('+'),
        ERROR('-'),
        INTEGER(':'),
        BULK('$'),
        ARRAY('*');

        private final byte sigil;

        Type(char sigil) {
            this.sigil = (byte) sigil;
        }

        public byte sigil() {
            return sigil;
        }
    }

    private static final Frame NULL_BULK = new Frame(Type.BULK, null, 0, null, null);
    private static final Frame NULL_ARRAY = new Frame(Type.ARRAY, null, 0, null, null);
    private static final Frame OK = new Frame(Type.SIMPLE, "OK", 0, null, null);

    private final Type type;
    private final String text;
    private final long integer;
    private final byte[] bulk;
    private final List<Frame> items;

    private Frame(Type type, String text, long integer, byte[] bulk, List<Frame> items) {
        this.type = type;
        this.text = text;
        this.integer = integer;
        this.bulk = bulk;
        this.items = items;
    }

    public static Frame simple(String text) {
        return new Frame(Type.SIMPLE, checkLine(text), 0, null, null);
    }

    public static Frame ok() {
        return OK;
    }

    public static Frame error(String message) {
        return new Frame(Type.ERROR, checkLine(message), 0, null, null);
    }

    public static Frame integer(long value) {
        return new Frame(Type.INTEGER, null, value, null, null);
    }

    public static Frame bulk(byte[] payload) {
        if (payload == null) return NULL_BULK;
        return new Frame(Type.BULK, null, 0, payload.clone(), null);
    }

    public static Frame bulk(String payload) {
        if (payload == null) return NULL_BULK;
        return new Frame(Type.BULK, null, 0, payload.getBytes(StandardCharsets.UTF_8), null);
    }

    public static Frame nullBulk() {
        return NULL_BULK;
    }

    public static Frame array(List<Frame> elements) {
        if (elements == null) return NULL_ARRAY;
        return new Frame(Type.ARRAY, null, 0, null, Collections.unmodifiableList(new ArrayList<>(elements)));
    }

    public static Frame array(Frame... elements) {
        return array(Arrays.asList(elements));
    }

    public static Frame nullArray() {
        return NULL_ARRAY;
    }

    /** Builds a request array of bulk strings, e.g. {@code command("SET", "k", "v")}. */
    public static Frame command(String... parts) {
        List<Frame> elements = new ArrayList<>(parts.length);
        for (String part : parts) {
            elements.add(bulk(part));
        }
        return array(elements);
    }

    // Codec-internal constructors: payloads here are freshly allocated and owned.
    static Frame ownedBulk(byte[] payload) {
        return new Frame(Type.BULK, null, 0, payload, null);
    }

    static Frame ownedArray(List<Frame> elements) {
        return new Frame(Type.ARRAY, null, 0, null, Collections.unmodifiableList(elements));
    }

    static Frame trustedText(Type type, String text) {
        return new Frame(type, text, 0, null, null);
    }

    private static String checkLine(String text) {
        Objects.requireNonNull(text, "text");
        if (text.indexOf('\r') >= 0 || text.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("simple strings and errors cannot contain CR or LF");
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                i++;
            } else if (Character.isSurrogate(c)) {
                // would be written as '?' on the wire
                throw new IllegalArgumentException("unpaired surrogate at index " + i);
            }
        }
        return text;
    }

    public Type type() {
        return type;
    }

    public boolean isNull() {
        return (type == Type.BULK && bulk == null) || (type == Type.ARRAY && items == null);
    }

    public boolean isError() {
        return type == Type.ERROR;
    }

    /** Text of a simple string or error frame. */
    public String text() {
        if (type != Type.SIMPLE && type != Type.ERROR) {
            throw new IllegalStateException("not a simple string or error: " + type);
        }
        return text;
    }

    public long integer() {
        if (type != Type.INTEGER) {
            throw new IllegalStateException("not an integer: " + type);
        }
        return integer;
    }

    /** Copy of the bulk payload, or null for the null bulk string. */
    public byte[] bytes() {
        if (type != Type.BULK) {
            throw new IllegalStateException("not a bulk string: " + type);
        }
        return bulk == null ? null : bulk.clone();
    }

    /** Bulk payload decoded as UTF-8, or null for the null bulk string. */
    public String bulkString() {
        if (type != Type.BULK) {
            throw new IllegalStateException("not a bulk string: " + type);
        }
        return bulk == null ? null : new String(bulk, StandardCharsets.UTF_8);
    }

    public List<Frame> elements() {
        if (type != Type.ARRAY) {
            throw new IllegalStateException("not an array: " + type);
        }
        return items;
    }

    // Read-only view for the codec.
    byte[] rawBytes() {
        return bulk;
    }

    public int bulkLength() {
        return bulk == null ? -1 : bulk.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Frame)) return false;
        Frame other = (Frame) o;
        return type == other.type
                && integer == other.integer
                && Objects.equals(text, other.text)
                && Arrays.equals(bulk, other.bulk)
                && Objects.equals(items, other.items);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(type, text, integer, items);
        return 31 * result + Arrays.hashCode(bulk);
    }

    @Override
    public String toString() {
        switch (type) {
            case SIMPLE:
                return "Simple(" + text + ")";
            case ERROR:
                return "Error(" + text + ")";
            case INTEGER:
                return "Integer(" + integer + ")";
            case BULK:
                return bulk == null ? "Bulk(null)" : "Bulk(" + new String(bulk, StandardCharsets.UTF_8) + ")";
            case ARRAY:
                return items == null ? "Array(null)" : "Array" + items;
            default:
                throw new IllegalStateException("unknown frame type " + type);
        }
    }
}
