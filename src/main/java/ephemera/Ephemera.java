package ephemera;

import ephemera.cache.Entry;
import ephemera.cache.ExpiringCache;
import ephemera.cache.TtlCache;
import ephemera.cache.config.CacheConfig;
import ephemera.config.Options;

import java.time.Duration;
import java.util.Optional;

public class Ephemera<V> implements ExpiringCache<V> {
    private final ExpiringCache<V> cache;

    Ephemera(ExpiringCache<V> cache) {
        this.cache = cache;
    }

    public static <V> Ephemera<V> open() {
        return open(Options.defaults.cache);
    }

    public static <V> Ephemera<V> open(Duration defaultExpiration, Duration cleanupInterval) {
        return new Ephemera<>(TtlCache.open(defaultExpiration, cleanupInterval));
    }

    public static <V> Ephemera<V> open(CacheConfig cacheConfig) {
        return new Ephemera<>(TtlCache.<V>builder(cacheConfig).build());
    }

    @Override
    public void set(String key, V value) {
        cache.set(key, value);
    }

    @Override
    public void set(String key, V value, Duration ttl) {
        cache.set(key, value, ttl);
    }

    @Override
    public Optional<V> get(String key) {
        return cache.get(key);
    }

    @Override
    public Entry<V> getItem(String key) {
        return cache.getItem(key);
    }

    @Override
    public void delete(String key) {
        cache.delete(key);
    }

    @Override
    public boolean isExpired(String key) {
        return cache.isExpired(key);
    }

    @Override
    public int size() {
        return cache.size();
    }

    @Override
    public void close() {
        cache.close();
    }
}
