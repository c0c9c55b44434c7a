package com.worldsentinel.analysis.entity;

/**
 * Static configuration that cannot be used. Raised at load time only, never mid-cycle.
 */
public class MalformedConfigurationException extends RuntimeException {
    public MalformedConfigurationException(String message) {
        super(message);
    }
}
