package com.vidnyan.mesh.domain.expression;

import java.util.Optional;

/**
 * Naming conventions that map identifiers to entity names.
 * Results of these heuristics are {@link Confidence#INFERRED}.
 */
public final class EntityNames {

    private EntityNames() {
    }

    /**
     * Singularize and capitalize a collection identifier: {@code orderItems -> OrderItem},
     * {@code categories -> Category}, {@code address -> Address}.
     */
    public static String toEntityName(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            return identifier;
        }
        return capitalize(singularize(identifier));
    }

    public static String singularize(String word) {
        if (word.endsWith("ies") && word.length() > 3) {
            return word.substring(0, word.length() - 3) + "y";
        }
        if (word.endsWith("s") && !word.endsWith("ss") && word.length() > 1) {
            return word.substring(0, word.length() - 1);
        }
        return word;
    }

    public static String capitalize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    /**
     * Entity name implied by a foreign-key style field name:
     * {@code customerId -> Customer}, {@code order_item_id -> OrderItem}.
     */
    public static Optional<String> referencedEntity(String fieldName) {
        String stem;
        if (fieldName.endsWith("_id") && fieldName.length() > 3) {
            stem = fieldName.substring(0, fieldName.length() - 3);
        } else if (fieldName.endsWith("Id") && fieldName.length() > 2) {
            stem = fieldName.substring(0, fieldName.length() - 2);
        } else {
            return Optional.empty();
        }
        return Optional.of(capitalize(snakeToCamel(stem)));
    }

    private static String snakeToCamel(String name) {
        StringBuilder result = new StringBuilder();
        boolean upperNext = false;
        for (char c : name.toCharArray()) {
            if (c == '_') {
                upperNext = true;
            } else if (upperNext) {
                result.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                result.append(c);
            }
        }
        return result.toString();
    }
}
