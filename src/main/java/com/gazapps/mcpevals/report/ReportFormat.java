package com.gazapps.mcpevals.report;

import java.util.Locale;

public enum ReportFormat {
    JSON("json"),
    SUMMARY("summary"),
    DETAILED("detailed"),
    CLEAN("clean");

    private final String name;

    ReportFormat(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    public static ReportFormat fromName(String name) {
        if (name == null || name.isBlank()) {
            return CLEAN;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (ReportFormat format : values()) {
            if (format.name.equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unsupported output format: " + name + " (expected json, summary, detailed or clean)");
    }
}
