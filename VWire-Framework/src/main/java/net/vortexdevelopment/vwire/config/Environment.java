package net.vortexdevelopment.vwire.config;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads container properties with support for:
 * - Environment variables (highest priority)
 * - System properties
 * - vwire.properties file (lowest priority)
 */
public class Environment {

    public static final String PROPERTIES_FILE = "vwire.properties";

    private static volatile Environment instance;
    private final Properties fileProperties;

    private Environment() {
        this(loadPropertiesFile());
    }

    /**
     * Create an environment backed by the given file properties instead of {@value #PROPERTIES_FILE}.
     * Environment variables and system properties still take precedence.
     *
     * @param fileProperties The lowest priority property source
     */
    public Environment(@NotNull Properties fileProperties) {
        this.fileProperties = fileProperties;
    }

    /**
     * Get the shared Environment instance, loading {@value #PROPERTIES_FILE} on first access.
     *
     * @return The Environment instance
     */
    public static Environment getInstance() {
        if (instance == null) {
            synchronized (Environment.class) {
                if (instance == null) {
                    instance = new Environment();
                }
            }
        }
        return instance;
    }

    /**
     * Looks for vwire.properties in the following order:
     * <ol>
     *   <li>Current working directory</li>
     *   <li>Classpath resource</li>
     * </ol>
     */
    private static Properties loadPropertiesFile() {
        Properties properties = new Properties();

        File propertiesFile = new File(System.getProperty("user.dir"), PROPERTIES_FILE);
        if (propertiesFile.isFile()) {
            try (FileInputStream fileInputStream = new FileInputStream(propertiesFile)) {
                properties.load(fileInputStream);
                return properties;
            } catch (IOException e) {
                System.err.println("Unable to read " + propertiesFile.getAbsolutePath() + ", falling back to classpath: " + e.getMessage());
            }
        }

        try (InputStream inputStream = Environment.class.getClassLoader().getResourceAsStream(PROPERTIES_FILE)) {
            if (inputStream != null) {
                properties.load(inputStream);
            }
        } catch (IOException e) {
            System.err.println("Unable to read classpath resource " + PROPERTIES_FILE + ": " + e.getMessage());
        }
        return properties;
    }

    /**
     * Get a property value with resolution priority:
     * 1. Environment variables (converted from dot notation to UPPER_SNAKE_CASE)
     * 2. System properties
     * 3. vwire.properties file
     *
     * @param key The property key (supports dot notation, e.g., "vwire.debug.all")
     * @return The property value, or null if not found
     */
    @Nullable
    public String getProperty(String key) {
        if (key == null || key.isEmpty()) {
            return null;
        }

        String value = System.getenv(convertToEnvKey(key));
        if (value != null) {
            return value;
        }

        value = System.getProperty(key);
        if (value != null) {
            return value;
        }

        return fileProperties.getProperty(key);
    }

    public String getProperty(String key, String defaultValue) {
        String value = getProperty(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Get a property value as a boolean.
     *
     * @param key The property key
     * @param defaultValue The default value if property is not found
     * @return The boolean value
     */
    public boolean getPropertyAsBoolean(String key, boolean defaultValue) {
        String value = getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    /**
     * Convert a property key from dot notation to environment variable format.
     * Example: "vwire.debug.all" -> "VWIRE_DEBUG_ALL"
     */
    private String convertToEnvKey(String key) {
        return key.toUpperCase().replace('.', '_').replace('-', '_');
    }
}
