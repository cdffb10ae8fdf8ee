package com.example.pulsemonitor.exception;

/**
 * A rule, escalation policy or channel definition was rejected at registration.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
