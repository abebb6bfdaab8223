package com.vidnyan.mesh.domain.spec;

/**
 * Timer on an entity. {@code action} names a function and {@code escalationEvent}
 * an event; either may be null.
 */
public record Deadline(String entity, String duration, String action, String escalationEvent) {
}
