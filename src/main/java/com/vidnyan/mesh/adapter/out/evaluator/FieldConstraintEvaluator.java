package com.vidnyan.mesh.adapter.out.evaluator;

import com.vidnyan.mesh.domain.rule.*;
import com.vidnyan.mesh.domain.spec.FieldDefinition;
import com.vidnyan.mesh.domain.spec.Specification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Contradictory bounds on entity fields and function inputs.
 * Negative lengths carry a patch resetting the bound to zero; inverted ranges
 * need two edits and are left to the author.
 */
@Slf4j
@Component
public class FieldConstraintEvaluator implements SpecRule {

    @Override
    public String id() {
        return "field-constraint";
    }

    @Override
    public List<ValidationError> check(Specification spec) {
        List<ValidationError> errors = new ArrayList<>();
        spec.entities().forEach((entity, def) -> def.fields().forEach((field, fd) ->
                checkField("entities." + entity + ".fields." + field, fd, errors)));
        spec.functions().forEach((name, fn) -> fn.input().forEach((input, fd) ->
                checkField("functions." + name + ".input." + input, fd, errors)));
        log.debug("Field constraint check found {} errors", errors.size());
        return errors;
    }

    private void checkField(String path, FieldDefinition field, List<ValidationError> errors) {
        if (field.min() != null && field.max() != null && field.min().compareTo(field.max()) > 0) {
            errors.add(ValidationError.builder()
                    .path(path)
                    .code("CNS-001")
                    .category(Category.CONSTRAINT)
                    .severity(Severity.ERROR)
                    .message("min (" + field.min() + ") is greater than max (" + field.max() + ")")
                    .expected("min <= max")
                    .actual("min=" + field.min() + ", max=" + field.max())
                    .build());
        }

        if (field.minLength() != null && field.maxLength() != null && field.minLength() > field.maxLength()) {
            errors.add(ValidationError.builder()
                    .path(path)
                    .code("CNS-002")
                    .category(Category.CONSTRAINT)
                    .severity(Severity.ERROR)
                    .message("minLength (" + field.minLength() + ") is greater than maxLength (" + field.maxLength() + ")")
                    .expected("minLength <= maxLength")
                    .actual("minLength=" + field.minLength() + ", maxLength=" + field.maxLength())
                    .build());
        }

        negativeLength(path, "minLength", field.minLength(), errors);
        negativeLength(path, "maxLength", field.maxLength(), errors);
    }

    private void negativeLength(String path, String bound, Integer value, List<ValidationError> errors) {
        if (value != null && value < 0) {
            errors.add(ValidationError.builder()
                    .path(path + "." + bound)
                    .code("CNS-003")
                    .category(Category.CONSTRAINT)
                    .severity(Severity.ERROR)
                    .message(bound + " must not be negative")
                    .expected(">= 0")
                    .actual(String.valueOf(value))
                    .fix(FixPatch.replace(path + "." + bound, 0))
                    .build());
        }
    }
}
