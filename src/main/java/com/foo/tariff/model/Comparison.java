package com.foo.tariff.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum Comparison {
    EQ("eq"),
    NE("ne"),
    GT("gt"),
    GE("ge"),
    LT("lt"),
    LE("le");

    private final String code;

    Comparison(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isOrdering() {
        return this != EQ && this != NE;
    }

    public static Optional<Comparison> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values()).filter(c -> c.code.equals(normalized)).findFirst();
    }

    boolean test(int compareResult) {
        return switch (this) {
            case EQ -> compareResult == 0;
            case NE -> compareResult != 0;
            case GT -> compareResult > 0;
            case GE -> compareResult >= 0;
            case LT -> compareResult < 0;
            case LE -> compareResult <= 0;
        };
    }
}
