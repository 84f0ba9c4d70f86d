package space.ketterling.forecastgraph.config;

import space.ketterling.forecastgraph.units.UnitSystem;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * Groups the API port, upstream NWS settings, the retry policy and the
 * defaults applied to display-instance config messages that omit a field.
 * </p>
 */
public record AppConfig(
        // API
        int apiPort,

        // NWS
        String nwsUserAgent,
        String nwsBaseUrl,
        Duration nwsConnectTimeout,
        Duration nwsRequestTimeout,

        // Retry policy (per fetch invocation)
        int fetchMaxRetries,
        Duration fetchRetryBaseDelay,

        // Instance defaults
        Duration defaultUpdateInterval,
        int defaultHoursToShow,
        UnitSystem defaultUnits) {

    public static final int MAX_HOURS_TO_SHOW = 48;

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read application.properties", e);
        }
        return fromProperties(p);
    }

    /**
     * Builds configuration from a properties fallback; env vars and -D
     * properties still take precedence.
     */
    public static AppConfig fromProperties(Properties p) {
        int port = Integer.parseInt(envOr(p, "API_PORT", "api.port", "8080"));

        String ua = requireNonBlank(envOr(p, "NWS_USER_AGENT", "nws.userAgent", ""), "nws.userAgent");
        String baseUrl = stripTrailingSlash(envOr(p, "NWS_BASE_URL", "nws.baseUrl", "https://api.weather.gov"));
        Duration connectTimeout = Duration.parse(envOr(p, "NWS_CONNECT_TIMEOUT", "nws.connectTimeout", "PT10S"));
        Duration requestTimeout = Duration.parse(envOr(p, "NWS_REQUEST_TIMEOUT", "nws.requestTimeout", "PT20S"));

        int maxRetries = Integer.parseInt(envOr(p, "FETCH_MAX_RETRIES", "fetch.maxRetries", "3"));
        Duration retryBase = Duration.parse(envOr(p, "FETCH_RETRY_BASE_DELAY", "fetch.retryBaseDelay", "PT5S"));
        if (maxRetries < 0) {
            throw new IllegalStateException("fetch.maxRetries must be >= 0");
        }

        Duration updateInterval = Duration.parse(envOr(p, "INSTANCE_UPDATE_INTERVAL", "instance.updateInterval",
                "PT15M"));
        int hoursToShow = clampHours(Integer.parseInt(envOr(p, "INSTANCE_HOURS_TO_SHOW", "instance.hoursToShow",
                "48")));
        UnitSystem units = UnitSystem.parse(envOr(p, "INSTANCE_UNITS", "instance.units", "imperial"));

        return new AppConfig(
                port,
                ua,
                baseUrl,
                connectTimeout,
                requestTimeout,
                maxRetries,
                retryBase,
                updateInterval,
                hoursToShow,
                units);
    }

    /**
     * Bounds a display window length to [1, 48] hours.
     */
    public static int clampHours(int hours) {
        return Math.max(1, Math.min(MAX_HOURS_TO_SHOW, hours));
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        return p.getProperty(propKey, def);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String v, String propKey) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + propKey + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }

    private static String stripTrailingSlash(String url) {
        if (url.endsWith("/"))
            return url.substring(0, url.length() - 1);
        return url;
    }
}
