package com.tethersystems.live;

/**
 * A commander binding, capability set or configuration value is invalid, or a helper was used
 * on a connection that lacks the capability it needs.
 */
public class ConfigurationException extends TetherException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
