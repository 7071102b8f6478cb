package com.foo.tariff.model;

import lombok.Builder;

import java.util.Set;

/**
 * 계산 요청. {@code scheduleVersion}이 없으면 최신 요율표를, {@code dueTypes}가 비어 있으면 전체 due
 * type을 계산한다.
 */
@Builder
public record CalculationRequest(
        VesselProfile profile, boolean includeExplanation, Long scheduleVersion, Set<String> dueTypes) {

    public CalculationRequest {
        dueTypes = dueTypes == null ? Set.of() : Set.copyOf(dueTypes);
    }
}
