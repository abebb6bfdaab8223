package com.vidnyan.mesh.domain.spec;

import com.vidnyan.mesh.domain.expression.Expression;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A command: typed input, preconditions, effects and error cases.
 */
public record FunctionDefinition(
    Map<String, FieldDefinition> input,
    List<Expression> pre,
    List<PostAction> post,
    List<ErrorCase> error
) {

    public FunctionDefinition {
        input = Collections.unmodifiableMap(new LinkedHashMap<>(input));
        pre = List.copyOf(pre);
        post = List.copyOf(post);
        error = List.copyOf(error);
    }
}
