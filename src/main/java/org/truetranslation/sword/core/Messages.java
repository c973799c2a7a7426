package org.truetranslation.sword.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.MessageFormat;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.PropertyResourceBundle;
import java.util.ResourceBundle;

/**
 * User-facing strings from the {@code i18n.messages} bundle. A translation
 * placed under {@code <config dir>/resources/i18n/} takes precedence over
 * the bundled one.
 */
public class Messages {
    private static final Logger LOG = LoggerFactory.getLogger(Messages.class);
    static final String BASE_NAME = "i18n.messages";

    private static Messages instance;
    private final ResourceBundle bundle;

    public Messages(Path configDir) {
        ResourceBundle external = configDir == null ? null : loadExternal(configDir, Locale.getDefault());
        this.bundle = external != null ? external : loadBundled();
    }

    public String get(String key) {
        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            return key;
        }
    }

    public String format(String key, Object... args) {
        return MessageFormat.format(get(key), args);
    }

    public static synchronized Messages getInstance() {
        if (instance == null) {
            instance = new Messages(null);
        }
        return instance;
    }

    /** Replaces the shared instance with one that also looks in {@code configDir}. */
    public static synchronized void init(Path configDir) {
        instance = new Messages(configDir);
    }

    private static ResourceBundle loadBundled() {
        try {
            return ResourceBundle.getBundle(BASE_NAME, Locale.getDefault());
        } catch (MissingResourceException e) {
            LOG.warn("No messages for locale {}, using default", Locale.getDefault());
            return ResourceBundle.getBundle(BASE_NAME, Locale.ROOT);
        }
    }

    private static ResourceBundle loadExternal(Path configDir, Locale locale) {
        for (String name : candidateNames(locale)) {
            Path bundlePath = configDir.resolve("resources").resolve(name.replace('.', '/') + ".properties");
            if (!Files.exists(bundlePath)) {
                continue;
            }
            try (InputStream is = Files.newInputStream(bundlePath);
                 InputStreamReader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                return new PropertyResourceBundle(reader);
            } catch (IOException e) {
                LOG.warn("Failed to load external bundle {}: {}", bundlePath, e.getMessage());
            }
        }
        return null;
    }

    private static String[] candidateNames(Locale locale) {
        String language = locale.getLanguage();
        String country = locale.getCountry();
        if (!language.isEmpty() && !country.isEmpty()) {
            return new String[] {
                BASE_NAME + "_" + language + "_" + country,
                BASE_NAME + "_" + language,
                BASE_NAME
            };
        } else if (!language.isEmpty()) {
            return new String[] { BASE_NAME + "_" + language, BASE_NAME };
        }
        return new String[] { BASE_NAME };
    }
}
