package com.labsignal.reasoning.service.service;

import java.util.List;

/**
 * A request that breaks input invariants, e.g. an inconsistent patient profile.
 */
public class InvalidRequestException extends RuntimeException {

    private final List<String> violations;

    public InvalidRequestException(List<String> violations) {
        super("Invalid request: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
