package com.vidnyan.mesh.domain.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Category {
    SCHEMA,
    REFERENCE,
    TYPE,
    LOGIC,
    CONSTRAINT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
