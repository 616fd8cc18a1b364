package ephemera.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import ephemera.cache.config.CacheConfig;
import ephemera.error.EphemeraConfigException;

public class Options {

    private static final Config config = ConfigFactory.load();
    public static final Options defaults = new Options();

    public final CacheConfig cache;

    public Options() {
        this(config);
    }

    public Options(Config config) {
        try {
            this.cache = new CacheConfig(config.getConfig("ephemera.cache"));
        } catch (ConfigException ex) {
            throw new EphemeraConfigException("Invalid ephemera configuration: " + ex.getMessage(), ex);
        }
    }

}
