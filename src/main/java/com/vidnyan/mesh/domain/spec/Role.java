package com.vidnyan.mesh.domain.spec;

import java.util.List;

public record Role(List<String> inherits, List<EntityPermission> entityPermissions, List<String> permissions) {

    public Role {
        inherits = inherits == null ? List.of() : List.copyOf(inherits);
        entityPermissions = entityPermissions == null ? List.of() : List.copyOf(entityPermissions);
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public static Role inheriting(String... parents) {
        return new Role(List.of(parents), List.of(), List.of());
    }

    public record EntityPermission(String entity, List<String> operations) {

        public EntityPermission {
            operations = operations == null ? List.of() : List.copyOf(operations);
        }
    }
}
