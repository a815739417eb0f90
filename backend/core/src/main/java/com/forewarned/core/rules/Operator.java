package com.forewarned.core.rules;

import java.util.Locale;
import java.util.Optional;

public enum Operator {
    AND,
    OR;

    public static Optional<Operator> fromText(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "and" -> Optional.of(AND);
            case "or" -> Optional.of(OR);
            default -> Optional.empty();
        };
    }

    public boolean combine(boolean left, boolean right) {
        return this == AND ? left && right : left || right;
    }
}
