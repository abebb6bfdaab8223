package com.vidnyan.mesh.domain.expression;

/**
 * How a reference was resolved.
 */
public enum Confidence {
    EXPLICIT,   // Declared in the specification (ref annotation, bare collection name)
    INFERRED    // Derived from an identifier naming convention
}
