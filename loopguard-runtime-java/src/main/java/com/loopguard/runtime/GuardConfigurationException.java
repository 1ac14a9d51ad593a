package com.loopguard.runtime;

/**
 * Invalid guard configuration, raised when a config object or component is built.
 */
public class GuardConfigurationException extends IllegalArgumentException {
    public GuardConfigurationException(String message) { super(message); }
    public GuardConfigurationException(String message, Throwable cause) { super(message, cause); }
}
