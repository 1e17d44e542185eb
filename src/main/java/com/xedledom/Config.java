package com.xedledom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime settings for a scrape run.
 *
 * Sources, lowest priority first: built-in defaults, {@code modeldex.properties} in
 * {@code ~/ModelDex} and then in the working directory, {@code .env} in the working
 * directory, environment variables, JVM system properties. Keys are stored in upper
 * snake case ({@code MODELDEX_LINKS_FILE}); dotted names ({@code links.file}) in
 * property files are accepted too.
 */
public final class Config {

    private static final Logger log = LoggerFactory.getLogger(Config.class);

    private static final String PREFIX = "MODELDEX_";
    private static final Path HOME_CONFIG = Path.of(System.getProperty("user.home"), "ModelDex", "modeldex.properties");
    private static final Path LOCAL_CONFIG = Path.of("modeldex.properties");
    private static final Path LOCAL_DOTENV = Path.of(".env");

    static final String LINKS_FILE = "LINKS_FILE";
    static final String OUTPUT_REGISTRY = "OUTPUT_REGISTRY";
    static final String OUTPUT_THUMBNAILS = "OUTPUT_THUMBNAILS";
    static final String USER_AGENT = "HTTP_USER_AGENT";
    static final String API_BASE = "CIVITAI_API_BASE";
    static final String WEB_BASE = "CIVITAI_WEB_BASE";
    static final String FETCH_TIMEOUT_SECONDS = "FETCH_TIMEOUT_SECONDS";
    static final String FETCH_RETRIES = "FETCH_RETRIES";
    static final String FETCH_BACKOFF_MIN_MS = "FETCH_BACKOFF_MIN_MS";
    static final String FETCH_BACKOFF_MAX_MS = "FETCH_BACKOFF_MAX_MS";
    static final String FETCH_COOLDOWN_SECONDS = "FETCH_COOLDOWN_SECONDS";
    static final String FETCH_HOST_MIN_INTERVAL_MS = "FETCH_HOST_MIN_INTERVAL_MS";
    static final String THUMBNAIL_TIMEOUT_SECONDS = "THUMBNAIL_TIMEOUT_SECONDS";
    static final String THUMBNAIL_MAX_PER_RECORD = "THUMBNAIL_MAX_PER_RECORD";
    static final String RESOLVER_HTML_FALLBACK = "RESOLVER_HTML_FALLBACK";
    static final String IDS_STRATEGY = "IDS_STRATEGY";
    static final String IDS_RANDOM_LENGTH = "IDS_RANDOM_LENGTH";
    static final String BATCH_LIMIT = "BATCH_LIMIT";
    static final String BATCH_WORKERS = "BATCH_WORKERS";
    static final String BATCH_DELAY_MIN_MS = "BATCH_DELAY_MIN_MS";
    static final String BATCH_DELAY_MAX_MS = "BATCH_DELAY_MAX_MS";

    private static final Map<String, String> DEFAULTS = Map.ofEntries(
            Map.entry(LINKS_FILE, "link.json"),
            Map.entry(OUTPUT_REGISTRY, "scraped_data/models.json"),
            Map.entry(OUTPUT_THUMBNAILS, "scraped_data/thumbnails"),
            Map.entry(USER_AGENT, "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
                    + "(KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"),
            Map.entry(API_BASE, "https://civitai.com/api/v1"),
            Map.entry(WEB_BASE, "https://civitai.com"),
            Map.entry(FETCH_TIMEOUT_SECONDS, "15"),
            Map.entry(FETCH_RETRIES, "3"),
            Map.entry(FETCH_BACKOFF_MIN_MS, "800"),
            Map.entry(FETCH_BACKOFF_MAX_MS, "1800"),
            Map.entry(FETCH_COOLDOWN_SECONDS, "30"),
            Map.entry(FETCH_HOST_MIN_INTERVAL_MS, "0"),
            Map.entry(THUMBNAIL_TIMEOUT_SECONDS, "8"),
            Map.entry(THUMBNAIL_MAX_PER_RECORD, "5"),
            Map.entry(RESOLVER_HTML_FALLBACK, "true"),
            Map.entry(IDS_STRATEGY, "sequential"),
            Map.entry(IDS_RANDOM_LENGTH, "4"),
            Map.entry(BATCH_LIMIT, "0"),
            Map.entry(BATCH_WORKERS, "1"),
            Map.entry(BATCH_DELAY_MIN_MS, "600"),
            Map.entry(BATCH_DELAY_MAX_MS, "1200")
    );

    private static final Map<String, String> cache = new ConcurrentHashMap<>();
    private static final List<String> loadedSources = new ArrayList<>();
    private static volatile boolean initialized = false;

    private Config() {}

    private static synchronized void loadIfNeeded() {
        if (initialized) return;

        loadFromPropertiesIfPresent(HOME_CONFIG);
        loadFromPropertiesIfPresent(LOCAL_CONFIG);
        loadFromDotEnvIfPresent(LOCAL_DOTENV);

        for (String key : DEFAULTS.keySet()) {
            String env = System.getenv(PREFIX + key);
            if (env != null && !env.isBlank()) {
                cache.put(key, env.trim());
            }
            String sys = System.getProperty(PREFIX + key);
            if (sys == null) {
                sys = System.getProperty(dotted(key));
            }
            if (sys != null && !sys.isBlank()) {
                cache.put(key, sys.trim());
            }
        }
        initialized = true;
    }

    static void loadFromPropertiesIfPresent(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return;
        }
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Could not read config file {}: {}", path, e.getMessage());
            return;
        }
        for (String name : props.stringPropertyNames()) {
            put(name, props.getProperty(name));
        }
        loadedSources.add(path.toString());
    }

    static void loadFromDotEnvIfPresent(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Could not read .env file {}: {}", path, e.getMessage());
            return;
        }
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            int eq = line.indexOf('=');
            if (eq <= 0) continue;
            put(line.substring(0, eq).trim(), stripQuotes(line.substring(eq + 1).trim()));
        }
        loadedSources.add(path.toString());
    }

    private static void put(String name, String value) {
        if (name == null || value == null) return;
        String key = canonicalKey(name);
        if (DEFAULTS.containsKey(key)) {
            cache.put(key, value.trim());
        }
    }

    static String canonicalKey(String name) {
        String key = name.trim().replace('.', '_').replace('-', '_').toUpperCase(Locale.ROOT);
        return key.startsWith(PREFIX) ? key.substring(PREFIX.length()) : key;
    }

    private static String dotted(String key) {
        return key.toLowerCase(Locale.ROOT).replace('_', '.');
    }

    private static String stripQuotes(String value) {
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '"' && last == '"') || (first == '\'' && last == '\'')) {
                return value.substring(1, value.length() - 1);
            }
        }
        return value;
    }

    static String get(String key) {
        loadIfNeeded();
        String value = cache.get(key);
        return (value == null || value.isBlank()) ? DEFAULTS.get(key) : value;
    }

    static int getInt(String key) {
        String value = get(key);
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for {}: '{}', using default {}", key, value, DEFAULTS.get(key));
            return Integer.parseInt(DEFAULTS.get(key));
        }
    }

    static boolean getBoolean(String key) {
        String value = get(key).trim().toLowerCase(Locale.ROOT);
        return value.equals("true") || value.equals("1") || value.equals("yes");
    }

    /** Overrides a value for this process, e.g. from command-line arguments. */
    public static void override(String key, String value) {
        loadIfNeeded();
        if (value != null && !value.isBlank()) {
            cache.put(canonicalKey(key), value.trim());
        }
    }

    public static Path getLinksFile() {
        return Path.of(get(LINKS_FILE));
    }

    public static Path getRegistryFile() {
        return Path.of(get(OUTPUT_REGISTRY));
    }

    public static Path getThumbnailDir() {
        return Path.of(get(OUTPUT_THUMBNAILS));
    }

    public static String getUserAgent() {
        return get(USER_AGENT);
    }

    public static String getApiBase() {
        return get(API_BASE);
    }

    public static String getWebBase() {
        return get(WEB_BASE);
    }

    public static int getFetchTimeoutSeconds() {
        return Math.max(1, getInt(FETCH_TIMEOUT_SECONDS));
    }

    public static int getFetchRetries() {
        return Math.max(1, getInt(FETCH_RETRIES));
    }

    public static int getBackoffMinMs() {
        return Math.max(0, getInt(FETCH_BACKOFF_MIN_MS));
    }

    public static int getBackoffMaxMs() {
        return Math.max(getBackoffMinMs(), getInt(FETCH_BACKOFF_MAX_MS));
    }

    public static int getCooldownSeconds() {
        return Math.max(0, getInt(FETCH_COOLDOWN_SECONDS));
    }

    public static int getHostMinIntervalMs() {
        return Math.max(0, getInt(FETCH_HOST_MIN_INTERVAL_MS));
    }

    public static int getThumbnailTimeoutSeconds() {
        return Math.max(1, getInt(THUMBNAIL_TIMEOUT_SECONDS));
    }

    public static int getThumbnailMaxPerRecord() {
        return Math.max(0, getInt(THUMBNAIL_MAX_PER_RECORD));
    }

    public static boolean isHtmlFallbackEnabled() {
        return getBoolean(RESOLVER_HTML_FALLBACK);
    }

    public static String getIdStrategy() {
        return get(IDS_STRATEGY).trim().toLowerCase(Locale.ROOT);
    }

    public static int getRandomIdLength() {
        return Math.max(1, getInt(IDS_RANDOM_LENGTH));
    }

    public static int getBatchLimit() {
        return Math.max(0, getInt(BATCH_LIMIT));
    }

    public static int getBatchWorkers() {
        return Math.max(1, getInt(BATCH_WORKERS));
    }

    public static int getBatchDelayMinMs() {
        return Math.max(0, getInt(BATCH_DELAY_MIN_MS));
    }

    public static int getBatchDelayMaxMs() {
        return Math.max(getBatchDelayMinMs(), getInt(BATCH_DELAY_MAX_MS));
    }

    public static void printStatus() {
        loadIfNeeded();
        log.info("Config sources: {}", loadedSources.isEmpty() ? "defaults/env only" : String.join(", ", loadedSources));
        log.info("Links file: {}", getLinksFile().toAbsolutePath());
        log.info("Registry file: {}", getRegistryFile().toAbsolutePath());
        log.info("Thumbnail dir: {}", getThumbnailDir().toAbsolutePath());
        log.info("API base: {} (HTML fallback {})", getApiBase(), isHtmlFallbackEnabled() ? "on" : "off");
        log.info("Fetch: {} attempts, timeout {}s, backoff {}-{}ms, 429 cooldown {}s",
                getFetchRetries(), getFetchTimeoutSeconds(), getBackoffMinMs(), getBackoffMaxMs(), getCooldownSeconds());
        log.info("Batch: workers={}, limit={}, ids={}", getBatchWorkers(), getBatchLimit(), getIdStrategy());
    }

    static synchronized void reset() {
        cache.clear();
        loadedSources.clear();
        initialized = false;
    }
}
