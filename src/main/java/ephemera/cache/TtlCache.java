package ephemera.cache;

import ephemera.cache.config.CacheConfig;
import ephemera.cache.sweep.ExpirationSweeper;
import ephemera.common.Timestamps;
import ephemera.config.Options;
import ephemera.error.KeyNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory cache with a fixed time to live per entry.
 * <p>
 * Expired entries are hidden from reads as soon as their TTL elapses but stay
 * stored until a background sweep, a {@link #delete(String)} or an overwrite
 * removes them. Reads never extend an entry's lifetime.
 */
public class TtlCache<V> implements ExpiringCache<V> {
    private static final Logger logger = LoggerFactory.getLogger(TtlCache.class);

    private final EntryTable<V> table;
    private final Clock clock;
    private final Duration defaultExpiration;
    private final Duration cleanupInterval;
    private final ExpirationSweeper sweeper;

    private TtlCache(
            EntryTable<V> table,
            Clock clock,
            Duration defaultExpiration,
            Duration cleanupInterval,
            Duration shutdownTimeout) {
        this.table = table;
        this.clock = clock;
        this.defaultExpiration = defaultExpiration;
        this.cleanupInterval = cleanupInterval;

        if (cleanupInterval.isZero() || cleanupInterval.isNegative()) {
            logger.debug("Background sweep disabled, expiration is lazy only");
            this.sweeper = null;
        } else {
            this.sweeper = new ExpirationSweeper(table, clock, shutdownTimeout);
            this.sweeper.start(cleanupInterval);
        }
    }

    public static <V> TtlCache<V> open(Duration defaultExpiration, Duration cleanupInterval) {
        return TtlCache.<V>builder()
                .withDefaultExpiration(defaultExpiration)
                .withCleanupInterval(cleanupInterval)
                .build();
    }

    @Override
    public void set(String key, V value) {
        set(key, value, Duration.ZERO);
    }

    @Override
    public void set(String key, V value, Duration ttl) {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(ttl, "ttl cannot be null");

        Duration effectiveTtl = ttl.isZero() ? defaultExpiration : ttl;
        Instant now = clock.instant();
        long expiration = Timestamps.expirationOf(Timestamps.toEpochNanos(now), effectiveTtl);
        table.put(key, new Entry<>(value, now, expiration));
    }

    @Override
    public Optional<V> get(String key) {
        return lookup(key).map(Entry::value);
    }

    @Override
    public Entry<V> getItem(String key) {
        return lookup(key).orElseThrow(() -> new KeyNotFoundException(key));
    }

    /**
     * Removes the entry for {@code key}. Expired entries that have not been
     * swept yet are still stored, so deleting them succeeds.
     *
     * @throws KeyNotFoundException if no entry is stored for the key
     */
    @Override
    public void delete(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        if (!table.remove(key)) {
            throw new KeyNotFoundException(key);
        }
    }

    @Override
    public boolean isExpired(String key) {
        return lookup(key).isEmpty();
    }

    /**
     * Number of stored entries. This includes entries that already expired
     * but were not swept yet, so it is not the number of live entries.
     */
    @Override
    public int size() {
        return table.size();
    }

    public Duration defaultExpiration() {
        return defaultExpiration;
    }

    public Duration cleanupInterval() {
        return cleanupInterval;
    }

    boolean isSweeping() {
        return sweeper != null && sweeper.isRunning();
    }

    private Optional<Entry<V>> lookup(String key) {
        Objects.requireNonNull(key, "key cannot be null");
        Entry<V> entry = table.get(key);
        if (entry == null || entry.isExpired(Timestamps.epochNanos(clock))) {
            return Optional.empty();
        }
        return Optional.of(entry);
    }

    /**
     * Stops the background sweep. The cache stays usable afterwards with lazy
     * expiration only.
     */
    @Override
    public void close() {
        if (sweeper != null) {
            sweeper.close();
        }
    }

    public static <V> Builder<V> builder() {
        return new Builder<>();
    }

    public static <V> Builder<V> builder(CacheConfig cacheConfig) {
        return new Builder<>(cacheConfig);
    }

    public static class Builder<V> {

        private Duration defaultExpiration;
        private Duration cleanupInterval;
        private Duration shutdownTimeout;
        private Clock clock = Clock.systemUTC();

        Builder() {
            this(Options.defaults.cache);
        }

        Builder(CacheConfig config) {
            this.defaultExpiration = config.defaultExpiration;
            this.cleanupInterval = config.sweep.interval;
            this.shutdownTimeout = config.sweep.shutdownTimeout;
        }

        public Builder<V> withDefaultExpiration(Duration defaultExpiration) {
            this.defaultExpiration = Objects.requireNonNull(defaultExpiration, "defaultExpiration cannot be null");
            return this;
        }

        public Builder<V> withCleanupInterval(Duration cleanupInterval) {
            this.cleanupInterval = Objects.requireNonNull(cleanupInterval, "cleanupInterval cannot be null");
            return this;
        }

        public Builder<V> withShutdownTimeout(Duration shutdownTimeout) {
            Objects.requireNonNull(shutdownTimeout, "shutdownTimeout cannot be null");
            if (shutdownTimeout.isNegative()) {
                throw new IllegalArgumentException("shutdownTimeout cannot be negative: " + shutdownTimeout);
            }
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public Builder<V> withClock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock cannot be null");
            return this;
        }

        public TtlCache<V> build() {
            return new TtlCache<>(new EntryTable<>(), clock, defaultExpiration, cleanupInterval, shutdownTimeout);
        }
    }
}
