package com.foo.tariff.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 운항 조건이 충족될 때 due type의 금액에 더하는 비율 할증(예: 근무시간 외 도선 50%).
 * 최소·최대 금액 보정 뒤, 감면 전에 적용한다.
 */
@Builder(toBuilder = true)
public record SurchargeRule(
        String ruleId,
        String port,
        String dueType,
        FlagCondition condition,
        BigDecimal percent,
        String reason,
        EffectivePeriod effectivePeriod) {

    public boolean isEffectiveOn(LocalDate date) {
        return effectivePeriod.contains(date);
    }
}
