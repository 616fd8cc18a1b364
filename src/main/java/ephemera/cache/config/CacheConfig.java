package ephemera.cache.config;

import com.typesafe.config.Config;
import ephemera.error.EphemeraConfigException;

import java.time.Duration;

public class CacheConfig {
    public final Duration defaultExpiration;
    public final Sweep sweep;

    public CacheConfig(Config config) {
        this.defaultExpiration = config.getDuration("default.expiration");
        this.sweep = new Sweep(config.getConfig("sweep"));
    }

    public static class Sweep {
        public final Duration interval;
        public final Duration shutdownTimeout;

        public Sweep(Config config) {
            this.interval = config.getDuration("interval");
            this.shutdownTimeout = config.getDuration("shutdown.timeout");
            if (this.shutdownTimeout.isNegative()) {
                throw new EphemeraConfigException("Invalid sweep shutdown timeout: " + this.shutdownTimeout);
            }
        }
    }
}
