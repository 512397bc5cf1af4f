package domreplay.player;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads {@code config.properties} from the classpath and exposes typed replay
 * settings with defaults.
 *
 * <p>A {@code config.local.properties} file on the classpath overrides any
 * value. Numeric settings outside their range fall back to the default.
 */
public class ReplayConfig {

    private static final Logger log = LoggerFactory.getLogger(ReplayConfig.class);

    private static final String CONFIG_FILE       = "config.properties";
    private static final String CONFIG_LOCAL_FILE = "config.local.properties";

    private static final String KEY_EXPLICIT_WAIT   = "replay.explicit.wait.sec";
    private static final String KEY_STEP_DELAY      = "replay.step.delay.ms";
    private static final String KEY_WAIT_PAGE_LOAD  = "replay.wait.for.page.load";

    private static final int     DEFAULT_EXPLICIT_WAIT  = 15;
    private static final long    DEFAULT_STEP_DELAY     = 0L;
    private static final boolean DEFAULT_WAIT_PAGE_LOAD = true;

    private final Properties props;

    /**
     * Loads {@value #CONFIG_FILE}, then applies {@value #CONFIG_LOCAL_FILE} on top when present.
     *
     * @throws IllegalStateException if the base file is missing or unreadable
     */
    public ReplayConfig() {
        props = new Properties();
        if (!loadInto(props, CONFIG_FILE)) {
            throw new IllegalStateException("Classpath resource not found: " + CONFIG_FILE);
        }
        try {
            loadInto(props, CONFIG_LOCAL_FILE);
        } catch (IllegalStateException e) {
            log.warn("Ignoring unreadable {}: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /** Package-private constructor for tests. */
    ReplayConfig(Properties props) {
        this.props = props;
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Explicit wait timeout for element lookup and page load, in seconds (default: 15, at least 1). */
    public int getExplicitWaitSec() {
        return (int) setting(KEY_EXPLICIT_WAIT, DEFAULT_EXPLICIT_WAIT, 1);
    }

    /** Pause between replayed transitions in milliseconds (default: 0). */
    public long getStepDelayMs() {
        return setting(KEY_STEP_DELAY, DEFAULT_STEP_DELAY, 0);
    }

    /** Whether to wait for {@code document.readyState == complete} after each fired event (default: true). */
    public boolean isWaitForPageLoad() {
        String raw = props.getProperty(KEY_WAIT_PAGE_LOAD);
        return raw == null || raw.isBlank() ? DEFAULT_WAIT_PAGE_LOAD : Boolean.parseBoolean(raw.trim());
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    /** @return {@code false} if {@code resource} is not on the classpath */
    private static boolean loadInto(Properties target, String resource) {
        try (InputStream in = ReplayConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) return false;
            target.load(in);
            log.debug("Loaded replay settings from {}", resource);
            return true;
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read " + resource, e);
        }
    }

    /** Whole-number setting; missing, malformed or out-of-range values yield {@code defaultValue}. */
    private long setting(String key, long defaultValue, long min) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        long value;
        try {
            value = Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Setting '{}' is not a whole number: '{}'; using {}", key, raw, defaultValue);
            return defaultValue;
        }
        if (value < min) {
            log.warn("Setting '{}' must be at least {}, got {}; using {}", key, min, value, defaultValue);
            return defaultValue;
        }
        return value;
    }
}
