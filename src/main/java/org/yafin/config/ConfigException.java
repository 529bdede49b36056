package org.yafin.config;

/**
 * Fatal configuration problem; the run aborts before any file is processed.
 */
public class ConfigException extends Exception {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
