package ephemera.cache;

import java.time.Duration;
import java.util.Optional;

public interface ExpiringCache<V> extends AutoCloseable {
    void set(String key, V value);

    void set(String key, V value, Duration ttl);

    Optional<V> get(String key);

    Entry<V> getItem(String key);

    void delete(String key);

    boolean isExpired(String key);

    int size();

    @Override
    void close();
}
