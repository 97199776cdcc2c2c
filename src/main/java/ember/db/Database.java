package ember.db;

import ember.utils.Time;

import java.util.Iterator;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The shared keyspace.
 * <p>
 * Every write to a key goes through one of the map's atomic per-key operations
 * ({@code put}, {@code compute}, {@code computeIfPresent}), which serialize writers
 * of the same key while leaving other keys untouched. Entries are immutable and
 * values are copied on the way in and out, so nothing outside this class ever holds
 * a reference into the store.
 * <p>
 * Expiry is lazy: an entry whose deadline has passed is treated as absent by every
 * read path, whether or not the {@link ExpirationSweeper} has removed it yet.
 */
public class Database {
    public static final long TTL_NOT_FOUND = -2;
    public static final long TTL_NO_EXPIRY = -1;

    private final ConcurrentHashMap<BinaryKey, ValueEntry> store = new ConcurrentHashMap<>();

    private final AtomicLong keyspaceHits = new AtomicLong(0);
    private final AtomicLong keyspaceMisses = new AtomicLong(0);
    private final AtomicLong expiredKeys = new AtomicLong(0);

    /** Copy of the value, or null if the key is absent or expired. */
    public byte[] get(BinaryKey key) {
        ValueEntry entry = lookup(key);
        if (entry == null) {
            keyspaceMisses.incrementAndGet();
            return null;
        }
        keyspaceHits.incrementAndGet();
        return entry.value().clone();
    }

    /** Unconditional upsert; replaces any previous value and deadline. */
    public void set(BinaryKey key, byte[] value, long expireAt) {
        store.put(key, new ValueEntry(value.clone(), expireAt));
    }

    public void set(BinaryKey key, byte[] value) {
        set(key, value, ValueEntry.NO_EXPIRY);
    }

    /** Stores the value only if the key is absent (or expired). Returns whether it was stored. */
    public boolean setIfAbsent(BinaryKey key, byte[] value, long expireAt) {
        long now = Time.now();
        ValueEntry fresh = new ValueEntry(value.clone(), expireAt);
        boolean[] state = new boolean[2]; // [0] = stored, [1] = replaced an expired entry
        store.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) {
                return existing;
            }
            state[0] = true;
            state[1] = existing != null;
            return fresh;
        });
        if (state[1]) expiredKeys.incrementAndGet();
        return state[0];
    }

    /** Stores the value only if the key is present and live. Returns whether it was stored. */
    public boolean setIfPresent(BinaryKey key, byte[] value, long expireAt) {
        long now = Time.now();
        ValueEntry fresh = new ValueEntry(value.clone(), expireAt);
        boolean[] state = new boolean[2]; // [0] = stored, [1] = dropped an expired entry
        store.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                state[1] = true;
                return null;
            }
            state[0] = true;
            return fresh;
        });
        if (state[1]) expiredKeys.incrementAndGet();
        return state[0];
    }

    /** Removes the key. Returns true only if a live entry was removed. */
    public boolean delete(BinaryKey key) {
        long now = Time.now();
        boolean[] state = new boolean[2]; // [0] = deleted live entry, [1] = dropped an expired entry
        store.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                state[1] = true;
            } else {
                state[0] = true;
            }
            return null;
        });
        if (state[1]) expiredKeys.incrementAndGet();
        return state[0];
    }

    public boolean exists(BinaryKey key) {
        return lookup(key) != null;
    }

    /**
     * Sets an absolute deadline on a live key. A deadline that is already due deletes
     * the key. Returns false if the key does not exist.
     */
    public boolean expireAt(BinaryKey key, long deadline) {
        long now = Time.now();
        if (deadline <= now) {
            return delete(key);
        }
        boolean[] state = new boolean[2]; // [0] = updated, [1] = dropped an expired entry
        store.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                state[1] = true;
                return null;
            }
            state[0] = true;
            return existing.withExpireAt(deadline);
        });
        if (state[1]) expiredKeys.incrementAndGet();
        return state[0];
    }

    /** Clears the deadline of a live key. Returns true if it had one. */
    public boolean persist(BinaryKey key) {
        long now = Time.now();
        boolean[] state = new boolean[2]; // [0] = persisted, [1] = dropped an expired entry
        store.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                state[1] = true;
                return null;
            }
            if (!existing.hasExpiry()) {
                return existing;
            }
            state[0] = true;
            return existing.withExpireAt(ValueEntry.NO_EXPIRY);
        });
        if (state[1]) expiredKeys.incrementAndGet();
        return state[0];
    }

    /**
     * Remaining time to live in millis, {@link #TTL_NO_EXPIRY} for a key without a
     * deadline, or {@link #TTL_NOT_FOUND} for an absent key.
     */
    public long ttlMillis(BinaryKey key) {
        long now = Time.now();
        ValueEntry entry = store.get(key);
        if (entry == null) return TTL_NOT_FOUND;
        if (entry.isExpired(now)) {
            removeIfExpired(key);
            return TTL_NOT_FOUND;
        }
        if (!entry.hasExpiry()) return TTL_NO_EXPIRY;
        return entry.getExpireAt() - now;
    }

    /** Physically removes the key if its deadline has passed. Idempotent. */
    public boolean removeIfExpired(BinaryKey key) {
        long now = Time.now();
        boolean[] removed = {false};
        store.computeIfPresent(key, (k, existing) -> {
            if (existing.isExpired(now)) {
                removed[0] = true;
                return null;
            }
            return existing;
        });
        if (removed[0]) expiredKeys.incrementAndGet();
        return removed[0];
    }

    private ValueEntry lookup(BinaryKey key) {
        ValueEntry entry = store.get(key);
        if (entry == null) return null;
        if (entry.isExpired(Time.now())) {
            removeIfExpired(key);
            return null;
        }
        return entry;
    }

    /** Number of stored entries, including expired ones the sweeper has not reached yet. */
    public int size() {
        return store.size();
    }

    /** Weakly consistent key iterator; never blocks writers. */
    public Iterator<BinaryKey> keyIterator() {
        return store.keySet().iterator();
    }

    public void clear() {
        store.clear();
    }

    public long getKeyspaceHits() {
        return keyspaceHits.get();
    }

    public long getKeyspaceMisses() {
        return keyspaceMisses.get();
    }

    public long getExpiredKeys() {
        return expiredKeys.get();
    }
}
