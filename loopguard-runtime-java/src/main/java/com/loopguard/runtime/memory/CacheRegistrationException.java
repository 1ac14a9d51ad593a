package com.loopguard.runtime.memory;

import com.loopguard.runtime.GuardConfigurationException;

/**
 * A cache handed to the memory guard cannot be observed or shrunk.
 */
public class CacheRegistrationException extends GuardConfigurationException {
    public CacheRegistrationException(String message) { super(message); }
}
