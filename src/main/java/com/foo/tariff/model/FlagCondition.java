package com.foo.tariff.model;

import lombok.Builder;

import java.util.Map;

/** 운항 플래그에 대한 단일 비교식. 예: {@code is_coaster eq true}, {@code num_operations ge 3}. */
@Builder
public record FlagCondition(OperationalFlag flag, Comparison comparison, String value) {

    public boolean isPresentIn(Map<OperationalFlag, Object> flags) {
        return flags.containsKey(flag);
    }

    /**
     * 플래그 값이 조건을 만족하는지 평가한다.
     *
     * @throws IllegalArgumentException 값이 플래그 타입과 맞지 않을 때
     */
    public boolean isSatisfiedBy(Object actual) {
        if (actual == null) {
            throw new IllegalArgumentException("Flag '" + flag.getCode() + "' has no value");
        }
        return switch (flag.getType()) {
            case BOOLEAN -> {
                if (!(actual instanceof Boolean b)) {
                    throw typeMismatch(actual);
                }
                yield comparison.test(Boolean.compare(b, Boolean.parseBoolean(value.trim())));
            }
            case INTEGER -> {
                if (!(actual instanceof Integer || actual instanceof Long)) {
                    throw typeMismatch(actual);
                }
                long expected = Long.parseLong(value.trim());
                yield comparison.test(Long.compare(((Number) actual).longValue(), expected));
            }
            case TEXT -> {
                if (!(actual instanceof String s)) {
                    throw typeMismatch(actual);
                }
                yield comparison.test(s.trim().equalsIgnoreCase(value.trim()) ? 0 : 1);
            }
        };
    }

    /** 요율표 게시 전 정합성 검사용. 비교 연산자와 기준값이 플래그 타입에 맞는지 확인한다. */
    public boolean isWellFormed() {
        if (flag == null || comparison == null || value == null || value.isBlank()) {
            return false;
        }
        String v = value.trim().toLowerCase();
        return switch (flag.getType()) {
            case BOOLEAN -> !comparison.isOrdering() && (v.equals("true") || v.equals("false"));
            case INTEGER -> v.matches("\\d+");
            case TEXT -> !comparison.isOrdering() && flag.getAllowedValues().contains(v);
        };
    }

    public String describe() {
        return flag.getCode() + " " + comparison.getCode() + " " + value;
    }

    private IllegalArgumentException typeMismatch(Object actual) {
        return new IllegalArgumentException(
                "Flag '%s' expects %s but was %s"
                        .formatted(flag.getCode(), flag.getType(), actual.getClass().getSimpleName()));
    }
}
