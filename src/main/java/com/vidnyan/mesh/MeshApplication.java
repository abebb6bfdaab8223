package com.vidnyan.mesh;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Mesh - specification integrity engine.
 * <p>
 * Parses formulas, builds the dependency graph of a specification and validates it.
 */
@SpringBootApplication
public class MeshApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeshApplication.class, args);
    }
}
