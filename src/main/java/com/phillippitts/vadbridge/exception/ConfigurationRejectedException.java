package com.phillippitts.vadbridge.exception;

import java.util.List;

/**
 * Thrown when a detection engine refuses the configuration passed to {@code init}.
 * The message lists every violation, not just the first one.
 */
public class ConfigurationRejectedException extends VadBridgeException {

    private final List<String> violations;

    public ConfigurationRejectedException(List<String> violations) {
        super(ErrorCode.CONFIGURATION_REJECTED,
                "Configuration rejected: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
