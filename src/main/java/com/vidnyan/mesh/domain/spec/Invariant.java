package com.vidnyan.mesh.domain.spec;

import com.vidnyan.mesh.domain.expression.Expression;

public record Invariant(String id, String entity, Expression expr) {
}
