package com.vidnyan.mesh.application.port.out;

/**
 * A specification document could not be read at all.
 */
public class SpecificationLoadException extends RuntimeException {

    public SpecificationLoadException(String message) {
        super(message);
    }

    public SpecificationLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
