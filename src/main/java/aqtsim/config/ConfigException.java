package aqtsim.config;

/**
 * Raised when a simulation configuration is malformed or cannot be read.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
