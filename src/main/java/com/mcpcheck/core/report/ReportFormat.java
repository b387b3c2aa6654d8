package com.mcpcheck.core.report;

/**
 * Supported report file formats.
 */
public enum ReportFormat {
    JSON("json"),
    JUNIT("xml");

    private final String extension;

    ReportFormat(String extension) {
        this.extension = extension;
    }

    public String extension() {
        return extension;
    }

    /**
     * Case-insensitive lookup accepting "json" and "junit".
     */
    public static ReportFormat parse(String value) {
        if (value != null) {
            for (ReportFormat format : values()) {
                if (format.name().equalsIgnoreCase(value.trim())) return format;
            }
        }
        throw new IllegalArgumentException("Unknown report format: " + value + ". Valid formats: json, junit");
    }
}
