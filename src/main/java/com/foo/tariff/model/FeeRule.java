package com.foo.tariff.model;

import lombok.Builder;

import java.math.BigDecimal;

/**
 * 구간이 없는 요금. {@code condition}이 있으면 조건부 요금이며, 해당 플래그 값이 없으면 계산할 수 없다.
 */
@Builder(toBuilder = true)
public record FeeRule(
        String ruleId,
        String port,
        String dueType,
        BigDecimal rate,
        RateUnit unit,
        BigDecimal baseFee,
        BigDecimal minAmount,
        BigDecimal maxAmount,
        String currency,
        OperationalFlag quantityFlag,
        FlagCondition condition,
        EffectivePeriod effectivePeriod)
        implements TariffRule {

    public boolean isConditional() {
        return condition != null;
    }
}
