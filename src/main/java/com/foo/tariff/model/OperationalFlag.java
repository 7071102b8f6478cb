package com.foo.tariff.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;
import java.util.Set;

/**
 * 요청에서 허용하는 운항 플래그 목록. 이 목록에 없는 플래그는 검증 단계에서 거부된다.
 *
 * <p>TEXT 플래그는 {@link #getAllowedValues()}에 정의된 값만 받는다.
 */
public enum OperationalFlag {
    COASTER("is_coaster", FlagType.BOOLEAN),
    DOUBLE_HULL_TANKER("double_hull_tanker", FlagType.BOOLEAN),
    OUTSIDE_WORKING_HOURS("outside_working_hours", FlagType.BOOLEAN),
    GOVERNMENT_VESSEL("government_vessel", FlagType.BOOLEAN),
    PLEASURE_VESSEL("pleasure_vessel", FlagType.BOOLEAN),
    NUM_OPERATIONS("num_operations", FlagType.INTEGER),
    VESSEL_TYPE(
            "vessel_type",
            FlagType.TEXT,
            Set.of(
                    "bulk_carrier",
                    "container",
                    "tanker",
                    "passenger",
                    "general_cargo",
                    "ro_ro",
                    "fishing",
                    "other"));

    private final String code;
    private final FlagType type;
    private final Set<String> allowedValues;

    OperationalFlag(String code, FlagType type) {
        this(code, type, Set.of());
    }

    OperationalFlag(String code, FlagType type, Set<String> allowedValues) {
        this.code = code;
        this.type = type;
        this.allowedValues = allowedValues;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public FlagType getType() {
        return type;
    }

    public Set<String> getAllowedValues() {
        return allowedValues;
    }

    public static Optional<OperationalFlag> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values()).filter(f -> f.code.equals(normalized)).findFirst();
    }

    /** 값이 이 플래그의 타입에 맞는지 확인한다. */
    public boolean accepts(Object value) {
        return switch (type) {
            case BOOLEAN -> value instanceof Boolean;
            case INTEGER -> (value instanceof Integer || value instanceof Long)
                    && ((Number) value).longValue() >= 0;
            case TEXT -> value instanceof String s && allowedValues.contains(s.trim().toLowerCase());
        };
    }
}
