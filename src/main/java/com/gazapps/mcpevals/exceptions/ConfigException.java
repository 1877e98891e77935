package com.gazapps.mcpevals.exceptions;

/**
 * Exception for problems loading or validating an evaluation suite file
 */
public class ConfigException extends Exception {

    private final String filePath;

    public ConfigException(String message) {
        super(message);
        this.filePath = null;
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.filePath = null;
    }

    public ConfigException(String filePath, String message, Throwable cause) {
        super(message, cause);
        this.filePath = filePath;
    }

    public String getFilePath() {
        return filePath;
    }
}
