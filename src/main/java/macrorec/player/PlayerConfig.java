package macrorec.player;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed player
 * configuration values with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code config.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class PlayerConfig {

    private static final Logger log = LoggerFactory.getLogger(PlayerConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    private static final String KEY_SPEED     = "player.speed";
    private static final double DEFAULT_SPEED = 1.0;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code config.local.properties} values override {@code config.properties}.
     */
    public PlayerConfig() {
        props = new Properties();
        load(CONFIG_FILE, true);
        load(CONFIG_LOCAL_FILE, false);
    }

    /** Package-private constructor for tests. */
    PlayerConfig(Properties props) {
        this.props = props;
    }

    /** Playback speed multiplier; anything not a positive finite number falls back to 1.0. */
    public double getSpeed() {
        double speed = getDouble(KEY_SPEED, DEFAULT_SPEED);
        if (!(speed > 0) || Double.isInfinite(speed)) {
            log.warn("'{}' must be a positive number, got {}; using default {}", KEY_SPEED, speed, DEFAULT_SPEED);
            return DEFAULT_SPEED;
        }
        return speed;
    }

    public void setSpeed(double speed) {
        props.setProperty(KEY_SPEED, String.valueOf(speed));
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void load(String resource, boolean warnIfMissing) {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                if (warnIfMissing) log.warn("Classpath resource not found: {}; player settings use defaults", resource);
                return;
            }
            props.load(in);
            log.debug("Loaded player config from {}", resource);
        } catch (IOException e) {
            log.warn("Failed to read {}: {}", resource, e.getMessage());
        }
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}'; using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }
}
