package ember.db;

/**
 * A stored value and its absolute deadline in epoch millis ({@link #NO_EXPIRY} when none).
 * Immutable: an update replaces the whole entry, so readers see either the old
 * value with its old deadline or the new value with its new one.
 */
public final class ValueEntry {
    public static final long NO_EXPIRY = -1;

    private final byte[] value;
    private final long expireAt;

    ValueEntry(byte[] value, long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    public boolean hasExpiry() {
        return expireAt != NO_EXPIRY;
    }

    public boolean isExpired(long now) {
        return expireAt != NO_EXPIRY && expireAt <= now;
    }

    public long getExpireAt() {
        return expireAt;
    }

    byte[] value() {
        return value;
    }

    ValueEntry withExpireAt(long newExpireAt) {
        return new ValueEntry(value, newExpireAt);
    }
}
