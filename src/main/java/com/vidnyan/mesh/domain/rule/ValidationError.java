package com.vidnyan.mesh.domain.rule;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A structured diagnostic.
 * Immutable value object.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationError(
    String path,
    String code,
    Category category,
    Severity severity,
    String message,
    String expected,
    String actual,
    @JsonProperty("valid_options") List<String> validOptions,
    @JsonProperty("auto_fixable") boolean autoFixable,
    @JsonProperty("fix_patch") FixPatch fixPatch
) {

    @JsonIgnore
    public boolean isBlocking() {
        return severity.isBlocking();
    }

    @Override
    public String toString() {
        return severity.wireName() + " " + code + " at " + path + ": " + message;
    }

    /**
     * Builder for ValidationError.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String path = "";
        private String code;
        private Category category = Category.SCHEMA;
        private Severity severity = Severity.ERROR;
        private String message;
        private String expected;
        private String actual;
        private List<String> validOptions;
        private boolean autoFixable;
        private FixPatch fixPatch;

        public Builder path(String path) { this.path = path; return this; }
        public Builder code(String code) { this.code = code; return this; }
        public Builder category(Category category) { this.category = category; return this; }
        public Builder severity(Severity severity) { this.severity = severity; return this; }
        public Builder message(String message) { this.message = message; return this; }
        public Builder expected(String expected) { this.expected = expected; return this; }
        public Builder actual(String actual) { this.actual = actual; return this; }
        public Builder validOptions(List<String> options) { this.validOptions = options == null ? null : List.copyOf(options); return this; }
        public Builder fix(FixPatch patch) { this.fixPatch = patch; this.autoFixable = patch != null; return this; }

        public ValidationError build() {
            return new ValidationError(path, code, category, severity, message, expected, actual,
                    validOptions, autoFixable, fixPatch);
        }
    }
}
