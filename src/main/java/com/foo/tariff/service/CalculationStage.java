package com.foo.tariff.service;

/** 계산 요청의 진행 단계. EXPLAINED는 설명 참조를 요청했을 때만 거친다. */
public enum CalculationStage {
    RECEIVED,
    VALIDATED,
    RESOLVED,
    COMPUTED,
    AGGREGATED,
    EXPLAINED,
    COMPLETED
}
