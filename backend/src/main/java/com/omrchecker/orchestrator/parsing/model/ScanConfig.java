package com.omrchecker.orchestrator.parsing.model;

/**
 * Template and tuning documents handed to the recognition engine as-is. Either may be null, in which
 * case the engine falls back to its own defaults.
 */
public record ScanConfig(String templateJson, String configJson) {

    public static ScanConfig defaults() {
        return new ScanConfig(null, null);
    }

    public boolean isDefault() {
        return isBlank(templateJson) && isBlank(configJson);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
