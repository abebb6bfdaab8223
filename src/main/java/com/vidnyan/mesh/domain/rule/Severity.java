package com.vidnyan.mesh.domain.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Errors and criticals block downstream use of a specification; warnings are advisory.
 */
public enum Severity {
    CRITICAL,
    ERROR,
    WARNING;

    public boolean isBlocking() {
        return this != WARNING;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
