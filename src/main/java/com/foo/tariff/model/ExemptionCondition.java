package com.foo.tariff.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * 특정 due type에 대한 감면 조건. 할인율 100은 전액 면제, 그 미만은 비율 감면이다.
 */
@Builder(toBuilder = true)
public record ExemptionCondition(
        String ruleId,
        String port,
        String dueType,
        FlagCondition condition,
        BigDecimal discountPercent,
        String reason,
        EffectivePeriod effectivePeriod) {

    public static final BigDecimal FULL_EXEMPTION = BigDecimal.valueOf(100);

    public boolean isFullExemption() {
        return discountPercent.compareTo(FULL_EXEMPTION) >= 0;
    }

    public boolean isEffectiveOn(LocalDate date) {
        return effectivePeriod.contains(date);
    }
}
