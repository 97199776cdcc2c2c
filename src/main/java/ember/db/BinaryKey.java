package ember.db;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Binary-safe map key. Holds its own copy of the bytes.
 */
public final class BinaryKey {
    private final byte[] bytes;
    private final int hash;

    private BinaryKey(byte[] bytes) {
        this.bytes = bytes;
        this.hash = Arrays.hashCode(bytes);
    }

    public static BinaryKey of(byte[] bytes) {
        return new BinaryKey(bytes.clone());
    }

    public static BinaryKey of(String key) {
        return new BinaryKey(key.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryKey)) return false;
        BinaryKey other = (BinaryKey) o;
        return hash == other.hash && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
