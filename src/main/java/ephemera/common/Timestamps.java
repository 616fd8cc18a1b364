package ephemera.common;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public final class Timestamps {
    private static final long NANOS_PER_SECOND = 1_000_000_000L;

    private Timestamps() {
    }

    public static long epochNanos(Clock clock) {
        return toEpochNanos(clock.instant());
    }

    public static long toEpochNanos(Instant instant) {
        return Math.addExact(Math.multiplyExact(instant.getEpochSecond(), NANOS_PER_SECOND), instant.getNano());
    }

    public static Instant fromEpochNanos(long epochNanos) {
        return Instant.ofEpochSecond(0, epochNanos);
    }

    /**
     * Computes the expiration stamp for an entry written at {@code now}.
     *
     * @param now epoch nanoseconds of the write
     * @param ttl time to live, zero or negative means the entry never expires
     * @return epoch nanoseconds after which the entry is expired, or 0 for no expiration
     */
    public static long expirationOf(long now, Duration ttl) {
        if (ttl.isZero() || ttl.isNegative()) {
            return 0L;
        }
        try {
            // Expiration must stay positive, 0 is reserved for "never".
            return Math.max(1L, Math.addExact(now, saturatedNanos(ttl)));
        } catch (ArithmeticException ex) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * Nanoseconds in {@code duration}, clamped to the {@code long} range.
     */
    public static long saturatedNanos(Duration duration) {
        try {
            return duration.toNanos();
        } catch (ArithmeticException ex) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }
}
