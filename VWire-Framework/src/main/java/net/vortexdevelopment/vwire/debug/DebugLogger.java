package net.vortexdevelopment.vwire.debug;

import net.vortexdevelopment.vwire.config.Environment;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Debug logger for container internals.
 * Classes are enabled one by one through {@link #enableDebugFor(Class[])}, or all at once with the
 * {@code vwire.debug.all} property.
 */
public class DebugLogger {

    public static final String DEBUG_ALL = "vwire.debug.all";

    private static final Set<String> enabledClasses = ConcurrentHashMap.newKeySet();
    private static final boolean GLOBAL_DEBUG = Environment.getInstance().getPropertyAsBoolean(DEBUG_ALL, false);

    public static void enableDebugFor(Class<?>... classes) {
        for (Class<?> clazz : classes) {
            enabledClasses.add(clazz.getName());
        }
    }

    public static boolean isEnabled(Class<?> clazz) {
        return GLOBAL_DEBUG || enabledClasses.contains(clazz.getName());
    }

    /**
     * Log a formatted debug message for a specific class.
     *
     * @param clazz the class to log for
     * @param format the format string
     * @param args the arguments
     */
    public static void log(Class<?> clazz, String format, Object... args) {
        if (isEnabled(clazz)) {
            String message = args.length == 0 ? format : String.format(format, args);
            System.out.println("[DEBUG:" + clazz.getSimpleName() + "] " + message);
        }
    }

    /**
     * Clear all enabled debug classes (for testing).
     */
    public static void clearAll() {
        enabledClasses.clear();
    }
}
