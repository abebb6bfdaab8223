package com.vidnyan.mesh.domain.graph;

public enum ChangeType {
    ADD,
    MODIFY,
    REMOVE
}
