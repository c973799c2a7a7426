package org.truetranslation.sword.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.truetranslation.sword.core.transport.ClientOptions;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

public class ConfigManager {
    private static final Logger LOG = LoggerFactory.getLogger(ConfigManager.class);

    static final String SWORD_PATH = "sword_path";
    static final String WORKERS = "workers";
    static final String TIMEOUT_SECONDS = "timeout_seconds";
    static final String MAX_RETRIES = "max_retries";
    static final String RETRY_DELAY_MS = "retry_delay_ms";
    static final String USER_AGENT = "user_agent";
    static final String VERBOSITY = "verbosity";

    private final Path configFilePath;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private Map<String, Object> config;

    public ConfigManager() {
        this(defaultConfigDir().resolve("config.json"));
    }

    public ConfigManager(Path configFilePath) {
        this.configFilePath = configFilePath;
        loadConfig();
    }

    public static Path defaultConfigDir() {
        String userHome = System.getProperty("user.home");
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win") && System.getenv("APPDATA") != null) {
            return Paths.get(System.getenv("APPDATA"), "sword-cli-java");
        } else if (os.contains("mac")) {
            return Paths.get(userHome, "Library", "Application Support", "sword-cli-java");
        }
        return Paths.get(userHome, ".config", "sword-cli-java");
    }

    private void loadConfig() {
        if (Files.exists(configFilePath)) {
            try (Reader reader = Files.newBufferedReader(configFilePath)) {
                Type type = new TypeToken<Map<String, Object>>() {}.getType();
                config = gson.fromJson(reader, type);
            } catch (IOException | JsonParseException e) {
                LOG.warn("Cannot read {}, using defaults: {}", configFilePath, e.getMessage());
                config = null;
            }
            if (config == null) config = new HashMap<>();
        } else {
            config = new HashMap<>();
            applyDefaults();
            saveConfig();
        }
        applyDefaults();
    }

    private void applyDefaults() {
        config.putIfAbsent(SWORD_PATH, "");
        config.putIfAbsent(WORKERS, 4.0);
        config.putIfAbsent(TIMEOUT_SECONDS, (double) ClientOptions.DEFAULT_TIMEOUT.getSeconds());
        config.putIfAbsent(MAX_RETRIES, (double) ClientOptions.DEFAULT_MAX_RETRIES);
        config.putIfAbsent(RETRY_DELAY_MS, (double) ClientOptions.DEFAULT_RETRY_DELAY.toMillis());
        config.putIfAbsent(USER_AGENT, ClientOptions.DEFAULT_USER_AGENT);
        config.putIfAbsent(VERBOSITY, 1.0);
    }

    private void saveConfig() {
        try {
            Files.createDirectories(configFilePath.toAbsolutePath().getParent());
            try (Writer writer = Files.newBufferedWriter(configFilePath)) {
                gson.toJson(config, writer);
            }
        } catch (IOException e) {
            LOG.warn(Messages.getInstance().format("error.config.save", e.getMessage()));
        }
    }

    public Path getConfigFilePath() { return configFilePath; }
    public Path getConfigDir() { return configFilePath.toAbsolutePath().getParent(); }

    /** Configured SWORD directory, or {@code ~/.sword} when none is set. */
    public Path getSwordPath() {
        String path = getString(SWORD_PATH);
        return path.isEmpty() ? LocalConfig.defaultSwordDir() : Paths.get(path);
    }
    public void setSwordPath(String path) { config.put(SWORD_PATH, path); saveConfig(); }

    public int getWorkers() { return getInt(WORKERS); }
    public void setWorkers(int workers) { config.put(WORKERS, (double) workers); saveConfig(); }

    public int getVerbosity() { return getInt(VERBOSITY); }
    public void setVerbosity(int level) { config.put(VERBOSITY, (double) level); saveConfig(); }

    public ClientOptions toClientOptions() {
        return new ClientOptions(
            Duration.ofSeconds(getInt(TIMEOUT_SECONDS)),
            getInt(MAX_RETRIES),
            Duration.ofMillis(getInt(RETRY_DELAY_MS)),
            getString(USER_AGENT));
    }

    private String getString(String key) {
        Object value = config.get(key);
        return value == null ? "" : value.toString();
    }

    // Gson reads every JSON number back as a Double.
    private int getInt(String key) {
        Object value = config.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return (int) Double.parseDouble(String.valueOf(value));
        } catch (NumberFormatException e) {
            LOG.warn("Ignoring non-numeric {} = {}", key, value);
            return 0;
        }
    }
}
