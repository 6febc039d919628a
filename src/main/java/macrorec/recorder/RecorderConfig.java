package macrorec.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads recorder settings from {@code config.properties} (classpath) and
 * exposes typed accessor methods with sensible defaults.
 *
 * <p>An optional {@code config.local.properties} file on the classpath
 * overrides any value from the base file (higher priority; not committed to VCS).
 *
 * <h3>Supported keys and defaults</h3>
 * <table>
 *   <tr><th>Key</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>recorder.rate.hz</td><td>100</td><td>Snapshots per second</td></tr>
 *   <tr><td>recorder.start.delay.sec</td><td>0</td><td>Delay before capture begins</td></tr>
 *   <tr><td>recorder.output.dir</td><td>recordings</td><td>Output directory</td></tr>
 *   <tr><td>recorder.session.prefix</td><td>recording</td><td>File-name prefix</td></tr>
 * </table>
 */
public class RecorderConfig {

    private static final Logger log = LoggerFactory.getLogger(RecorderConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    // Property keys
    private static final String KEY_RATE_HZ         = "recorder.rate.hz";
    private static final String KEY_START_DELAY_SEC = "recorder.start.delay.sec";
    private static final String KEY_OUTPUT_DIR      = "recorder.output.dir";
    private static final String KEY_SESSION_PREFIX  = "recorder.session.prefix";

    // Defaults
    private static final int    DEFAULT_RATE_HZ         = 100;
    private static final int    DEFAULT_START_DELAY_SEC = 0;
    private static final String DEFAULT_OUTPUT_DIR      = "recordings";
    private static final String DEFAULT_SESSION_PREFIX  = "recording";

    private final Properties props;

    // ── Construction ──────────────────────────────────────────────────────

    /**
     * Loads configuration from the classpath.
     *
     * <p>Both files are optional; missing keys fall back to the defaults above.
     */
    public RecorderConfig() {
        props = new Properties();
        loadBase();
        loadLocalOverrides();
    }

    /**
     * Package-private constructor for tests. Accepts a pre-populated
     * {@link Properties} instance, bypassing classpath I/O.
     */
    RecorderConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    /** Sampling rate in Hertz; non-positive values fall back to the default 100. */
    public int getRateHz() {
        int rate = getInt(KEY_RATE_HZ, DEFAULT_RATE_HZ);
        if (rate <= 0) {
            log.warn("'{}' must be positive, got {}; using default {}", KEY_RATE_HZ, rate, DEFAULT_RATE_HZ);
            return DEFAULT_RATE_HZ;
        }
        return rate;
    }

    public void setRateHz(int rateHz) {
        props.setProperty(KEY_RATE_HZ, String.valueOf(rateHz));
    }

    /** Seconds to wait before capture begins (default 0). */
    public int getStartDelaySec() {
        return Math.max(0, getInt(KEY_START_DELAY_SEC, DEFAULT_START_DELAY_SEC));
    }

    public void setStartDelaySec(int seconds) {
        props.setProperty(KEY_START_DELAY_SEC, String.valueOf(seconds));
    }

    /** Directory where recording JSON files are written (default {@code recordings}). */
    public String getOutputDir() {
        return props.getProperty(KEY_OUTPUT_DIR, DEFAULT_OUTPUT_DIR).trim();
    }

    public void setOutputDir(String dir) {
        props.setProperty(KEY_OUTPUT_DIR, dir);
    }

    /** Filename prefix for recording JSON files (default {@code recording}). */
    public String getSessionPrefix() {
        return props.getProperty(KEY_SESSION_PREFIX, DEFAULT_SESSION_PREFIX).trim();
    }

    public void setSessionPrefix(String prefix) {
        props.setProperty(KEY_SESSION_PREFIX, prefix);
    }

    // ── Internal helpers ──────────────────────────────────────────────────

    private void loadBase() {
        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                // Base file missing is tolerated, all defaults apply
                log.warn("Classpath resource not found: {}; all recorder settings use defaults",
                        CONFIG_FILE);
                return;
            }
            props.load(base);
            log.debug("Loaded recorder base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot load " + CONFIG_FILE, e);
        }
    }

    private void loadLocalOverrides() {
        try (InputStream local = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}; using base config only: {}",
                    CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}'; using default {}",
                    key, raw, defaultValue);
            return defaultValue;
        }
    }
}
