package com.foo.tariff.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/** 요율 적용 단위. 요율표 payload에서는 소문자 코드로 표기한다. */
public enum RateUnit {

    /** 건당 정액. */
    FLAT("flat"),

    /** GT당. */
    PER_GT("per_gt"),

    /** GT당 일당. 체류일수는 올림, 최소 1일. */
    PER_GT_PER_DAY("per_gt_per_day"),

    /** 100GT 단위(올림)당. */
    PER_100GT("per_100gt"),

    /** 100GT 단위(올림)당 일당. 체류일수는 {@link #PER_GT_PER_DAY}와 같이 센다. */
    PER_100GT_PER_DAY("per_100gt_per_day"),

    /** 구간 하한을 초과하는 100GT 단위(올림)당. 보통 base_fee와 함께 쓴다. */
    PER_100GT_ABOVE_MIN("per_100gt_above_min");

    private final String code;

    RateUnit(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static Optional<RateUnit> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase();
        return Arrays.stream(values()).filter(u -> u.code.equals(normalized)).findFirst();
    }

    @JsonCreator
    static RateUnit of(String code) {
        return fromCode(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown rate unit: " + code));
    }
}
