package com.vidnyan.mesh.domain.rule;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * A single add/replace/remove operation against the specification tree.
 * {@code path} uses the same dotted form as diagnostics.
 */
public record FixPatch(Op op, String path, Object value) {

    public enum Op {
        ADD,
        REPLACE,
        REMOVE;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static FixPatch replace(String path, Object value) {
        return new FixPatch(Op.REPLACE, path, value);
    }
}
