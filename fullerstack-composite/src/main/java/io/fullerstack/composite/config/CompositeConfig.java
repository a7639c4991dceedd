package io.fullerstack.composite.config;

import java.util.*;

/**
 * Hierarchical composite configuration backed by ResourceBundle.
 *
 * <p>Fallback chain:
 * <ol>
 *   <li>composite_{name}.properties (composite-specific)</li>
 *   <li>composite.properties (global defaults)</li>
 * </ol>
 *
 * <p>The composite name is turned into a locale language tag, which is how ResourceBundle
 * picks the more specific file. Names must therefore be valid language subtags
 * (2 to 8 letters, e.g. "routing", "health").
 *
 * <p><strong>Example Property Files:</strong>
 * <pre>
 * # composite.properties (global defaults)
 * watcher.max-consecutive-refires=16
 * diagnostics.max-items=100
 *
 * # composite_routing.properties (override for the "routing" composite)
 * diagnostics.max-items=500
 * </pre>
 *
 * <p><strong>System Property Overrides:</strong>
 * <p>System properties take precedence over all property files:
 * <pre>
 * java -Ddiagnostics.max-items=20 -jar app.jar
 * </pre>
 */
public class CompositeConfig {

    public static final String MAX_CONSECUTIVE_REFIRES = "watcher.max-consecutive-refires";
    public static final String DIAGNOSTICS_MAX_ITEMS = "diagnostics.max-items";

    private static final String BUNDLE = "composite";

    private final ResourceBundle bundle;
    private final String context;

    private CompositeConfig(ResourceBundle bundle, String context) {
        this.bundle = bundle;
        this.context = context;
    }

    /**
     * Get global configuration (composite.properties).
     *
     * @return Global configuration
     */
    public static CompositeConfig global() {
        ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE, Locale.ROOT);
        return new CompositeConfig(bundle, "global");
    }

    /**
     * Get configuration for a named composite, falling back to the global defaults.
     *
     * @param compositeName Composite name (e.g., "routing")
     * @return Composite-specific configuration
     */
    public static CompositeConfig forComposite(String compositeName) {
        Objects.requireNonNull(compositeName, "compositeName cannot be null");
        if (compositeName.isBlank()) {
            throw new IllegalArgumentException("compositeName cannot be blank");
        }

        Locale compositeLocale = Locale.forLanguageTag(compositeName);
        if (compositeLocale.getLanguage().isEmpty()) {
            // Not a usable language tag: only the global defaults apply
            return new CompositeConfig(ResourceBundle.getBundle(BUNDLE, Locale.ROOT), "composite:" + compositeName);
        }
        ResourceBundle bundle = ResourceBundle.getBundle(
            BUNDLE, compositeLocale, ResourceBundle.Control.getNoFallbackControl(ResourceBundle.Control.FORMAT_DEFAULT));
        return new CompositeConfig(bundle, "composite:" + compositeName);
    }

    /**
     * @return Cap on back-to-back already-fired signals a watcher tolerates
     */
    public int maxConsecutiveRefires() {
        int value = getInt(MAX_CONSECUTIVE_REFIRES, 16);
        if (value < 1) {
            throw new ConfigurationException(
                "Invalid value for key '" + MAX_CONSECUTIVE_REFIRES + "' in context " + context + ": " + value);
        }
        return value;
    }

    /**
     * @return Maximum number of items rendered by a diagnostic dump
     */
    public int diagnosticsMaxItems() {
        return getInt(DIAGNOSTICS_MAX_ITEMS, 100);
    }

    // =========================================================================
    // Type-safe getters with system property override support
    // =========================================================================

    /**
     * Get string value.
     *
     * <p>Checks system properties first, then ResourceBundle.
     *
     * @param key Property key
     * @return Property value
     * @throws ConfigurationException if key not found
     */
    public String getString(String key) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }

        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            throw new ConfigurationException(
                "Missing config key '" + key + "' in context: " + context, e
            );
        }
    }

    /**
     * Get string value with default.
     *
     * @param key Property key
     * @param defaultValue Default if not found
     * @return Property value or default
     */
    public String getString(String key, String defaultValue) {
        String sysProp = System.getProperty(key);
        if (sysProp != null) {
            return sysProp;
        }

        try {
            return bundle.getString(key);
        } catch (MissingResourceException e) {
            return defaultValue;
        }
    }

    /**
     * Get int value with default. A value that is present but malformed is an error.
     *
     * @param key Property key
     * @param defaultValue Default if not found
     * @return Property value as int or default
     * @throws ConfigurationException if the value is not an int
     */
    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException(
                "Invalid int value for key '" + key + "': " + value, e
            );
        }
    }

    /**
     * Check if key exists in configuration.
     *
     * @param key Property key
     * @return true if key exists
     */
    public boolean contains(String key) {
        if (System.getProperty(key) != null) {
            return true;
        }
        return bundle.containsKey(key);
    }

    /**
     * Get configuration context (for debugging).
     *
     * @return Context description (e.g., "global", "composite:routing")
     */
    public String context() {
        return context;
    }

    @Override
    public String toString() {
        return "CompositeConfig[context=" + context + "]";
    }
}
