package ephemera.cache;

import ephemera.common.Timestamps;

import java.time.Instant;
import java.util.Optional;

/**
 * A cached value with its creation time and expiration stamp.
 *
 * @param value      the cached value
 * @param created    when the entry was written
 * @param expiration epoch nanoseconds after which the entry is expired, 0 if it never expires
 */
public record Entry<V>(V value, Instant created, long expiration) {

    public static final long NO_EXPIRATION = 0L;

    public Entry {
        if (expiration < 0) {
            throw new IllegalArgumentException("expiration cannot be negative: " + expiration);
        }
    }

    public boolean isExpired(long now) {
        return expiration > 0 && now > expiration;
    }

    public Optional<Instant> expiresAt() {
        if (expiration == NO_EXPIRATION) {
            return Optional.empty();
        }
        return Optional.of(Timestamps.fromEpochNanos(expiration));
    }
}
