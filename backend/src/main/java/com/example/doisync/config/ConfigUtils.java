package com.example.doisync.config;

import org.springframework.core.env.Environment;

public final class ConfigUtils {

    private ConfigUtils() {}

    /**
     * Resolve a boolean flag from a dotted property, falling back to an env-style name
     * (e.g. {@code doisync.local.enabled} then {@code DOISYNC_LOCAL_ENABLED}).
     * "true", "yes" and "1" (case-insensitive) count as true.
     */
    public static boolean getBooleanFlag(Environment env, String primaryProp, String fallbackProp, boolean defaultValue) {
        String raw = getString(env, primaryProp, fallbackProp, null);
        if (raw == null || raw.isBlank()) return defaultValue;
        String v = raw.trim();
        return v.equalsIgnoreCase("true") || v.equalsIgnoreCase("yes") || v.equals("1");
    }

    /**
     * Return the first non-blank value of primaryProp, fallbackProp, else defaultValue.
     */
    public static String getString(Environment env, String primaryProp, String fallbackProp, String defaultValue) {
        if (env == null) return defaultValue;
        String v = primaryProp != null ? env.getProperty(primaryProp) : null;
        if ((v == null || v.isBlank()) && fallbackProp != null) {
            v = env.getProperty(fallbackProp);
        }
        return v == null || v.isBlank() ? defaultValue : v;
    }

    public static long getLong(Environment env, String primaryProp, String fallbackProp, long defaultValue) {
        String v = getString(env, primaryProp, fallbackProp, null);
        if (v == null) return defaultValue;
        try {
            return Long.parseLong(v.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }
}
