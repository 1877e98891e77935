package com.gazapps.mcpevals.model;

/**
 * Kind of server artifact, decides which runtime launches it.
 */
public enum ServerType {
    TYPESCRIPT_SCRIPT("TypeScript (npx tsx)"),
    NODE_SCRIPT("JavaScript (node)"),
    NATIVE_EXECUTABLE("Native executable"),
    PYTHON_SCRIPT("Python"),
    UNKNOWN("Unknown");

    private final String description;

    ServerType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
