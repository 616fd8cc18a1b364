package ephemera.error;

/**
 * Thrown when a key is not held by the cache. For reads this also covers
 * entries that are still stored but have already expired.
 */
public class KeyNotFoundException extends EphemeraException {
    private final String key;

    public KeyNotFoundException(String key) {
        super("Key not found: " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
