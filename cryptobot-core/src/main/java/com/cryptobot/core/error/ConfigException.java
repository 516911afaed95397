package com.cryptobot.core.error;

import java.util.List;

/**
 * Invalid or missing bot configuration. The bot never leaves STOPPED when this is raised.
 */
public class ConfigException extends TradingException {
    private final List<String> violations;

    public ConfigException(String message) {
        this(message, List.of());
    }

    public ConfigException(String message, List<String> violations) {
        super(violations.isEmpty() ? message : message + ": " + String.join(", ", violations));
        this.violations = List.copyOf(violations);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
        this.violations = List.of();
    }

    public List<String> getViolations() {
        return violations;
    }
}
