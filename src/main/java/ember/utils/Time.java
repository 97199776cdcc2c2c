package ember.utils;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-wide millisecond clock. Expiry deadlines are always read through here
 * so tests can swap in a controllable clock.
 */
public class Time {
    public interface Clock {
        long currentTimeMillis();
    }

    public static final long OVERFLOW = -1;

    private static final Clock SYSTEM_CLOCK = System::currentTimeMillis;
    private static final AtomicReference<Clock> clock = new AtomicReference<>(SYSTEM_CLOCK);

    public static long now() {
        return clock.get().currentTimeMillis();
    }

    /**
     * Absolute deadline {@code millis} from now. Non-positive input yields now;
     * {@link #OVERFLOW} if the sum does not fit in a long.
     */
    public static long deadlineAfter(long millis) {
        long now = now();
        if (millis <= 0) return now;
        if (millis > Long.MAX_VALUE - now) return OVERFLOW;
        return now + millis;
    }

    public static void setClock(Clock newClock) {
        clock.set(newClock);
    }

    public static void useSystemClock() {
        clock.set(SYSTEM_CLOCK);
    }
}
