package ephemera.cache;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Key to entry mapping guarded by a single reader-writer lock. Lookups and
 * scans share the read lock, every mutation takes the write lock.
 */
public class EntryTable<V> {
    private final Map<String, Entry<V>> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public Entry<V> get(String key) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return entries.get(key);
        } finally {
            readLock.unlock();
        }
    }

    public void put(String key, Entry<V> entry) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            entries.put(key, entry);
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes the entry regardless of its expiration.
     *
     * @return true if an entry was present
     */
    public boolean remove(String key) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Number of stored entries, expired ones included.
     */
    public int size() {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return entries.size();
        } finally {
            readLock.unlock();
        }
    }

    public List<String> expiredKeys(long now) {
        List<String> keys = new ArrayList<>();
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            for (Map.Entry<String, Entry<V>> entry : entries.entrySet()) {
                if (entry.getValue().isExpired(now)) {
                    keys.add(entry.getKey());
                }
            }
        } finally {
            readLock.unlock();
        }
        return keys;
    }

    /**
     * Removes the given keys whose current entry is expired at {@code now}.
     * Keys rewritten with a live entry since they were collected are kept.
     *
     * @return number of removed entries
     */
    public int removeExpired(Collection<String> keys, long now) {
        int removed = 0;
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            for (String key : keys) {
                Entry<V> entry = entries.get(key);
                if (entry != null && entry.isExpired(now)) {
                    entries.remove(key);
                    removed++;
                }
            }
        } finally {
            writeLock.unlock();
        }
        return removed;
    }
}
