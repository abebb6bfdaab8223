package com.vidnyan.mesh.domain.graph;

import java.util.Locale;

public enum EdgeRelation {
    REFERENCES,
    DERIVES_FROM,
    MODIFIES,
    CREATES,
    DELETES,
    TRIGGERS,
    DEPENDS_ON,
    BELONGS_TO;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
