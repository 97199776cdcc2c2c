package ember.db;

import ember.utils.Log;

import java.util.Iterator;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Active expiration. Each tick samples a bounded number of keys, resuming where the
 * previous tick stopped, and evicts the expired ones through
 * {@link Database#removeIfExpired}. Sampling repeats while more than a quarter of a
 * sample turned out to be expired, up to {@code maxRounds} samples per tick.
 */
public class ExpirationSweeper {
    private final Database db;
    private final long intervalMillis;
    private final int sampleSize;
    private final int maxRounds;

    private ScheduledExecutorService executor;
    private Iterator<BinaryKey> cursor;

    public ExpirationSweeper(Database db, long intervalMillis, int sampleSize, int maxRounds) {
        if (intervalMillis <= 0) throw new IllegalArgumentException("intervalMillis must be positive");
        if (sampleSize <= 0) throw new IllegalArgumentException("sampleSize must be positive");
        if (maxRounds <= 0) throw new IllegalArgumentException("maxRounds must be positive");
        this.db = db;
        this.intervalMillis = intervalMillis;
        this.sampleSize = sampleSize;
        this.maxRounds = maxRounds;
    }

    public synchronized void start() {
        if (executor != null) return;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "ember-sweeper");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleWithFixedDelay(this::tick, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        Log.debug("[Sweeper] Started, interval " + intervalMillis + "ms");
    }

    public synchronized void stop() {
        if (executor == null) return;
        executor.shutdownNow();
        executor = null;
    }

    public synchronized boolean isRunning() {
        return executor != null;
    }

    private void tick() {
        try {
            int expired = runOnce();
            if (expired > 0) {
                Log.debug("[Sweeper] Evicted " + expired + " expired keys. Database size: " + db.size());
            }
        } catch (Exception e) {
            // Keep the schedule alive; a failed tick is retried on the next one.
            Log.error("[Sweeper] Error: " + e.getMessage(), e);
        }
    }

    /** Runs one sweep cycle and returns how many keys it evicted. */
    public synchronized int runOnce() {
        int total = 0;
        for (int round = 0; round < maxRounds; round++) {
            if (db.size() == 0) break;

            if (cursor == null || !cursor.hasNext()) {
                cursor = db.keyIterator();
            }

            int checked = 0;
            int expired = 0;
            while (cursor.hasNext() && checked < sampleSize) {
                if (db.removeIfExpired(cursor.next())) {
                    expired++;
                }
                checked++;
            }
            total += expired;

            if (checked == 0 || expired <= sampleSize / 4) {
                break;
            }
        }
        return total;
    }
}
