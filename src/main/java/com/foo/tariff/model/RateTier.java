package com.foo.tariff.model;

import lombok.Builder;

import java.math.BigDecimal;

/** 톤수 구간 요율. 구간은 {@code [minGt, maxGt)}이며 maxGt가 없으면 상한 없음. */
@Builder(toBuilder = true)
public record RateTier(
        String ruleId,
        String port,
        String dueType,
        BigDecimal minGt,
        BigDecimal maxGt,
        BigDecimal rate,
        RateUnit unit,
        BigDecimal baseFee,
        BigDecimal minAmount,
        BigDecimal maxAmount,
        String currency,
        OperationalFlag quantityFlag,
        EffectivePeriod effectivePeriod)
        implements TariffRule {

    public boolean containsTonnage(BigDecimal grossTonnage) {
        return grossTonnage.compareTo(minGt) >= 0
                && (maxGt == null || grossTonnage.compareTo(maxGt) < 0);
    }

    public boolean overlapsTonnage(RateTier other) {
        boolean thisStartsBeforeOtherEnds = other.maxGt == null || minGt.compareTo(other.maxGt) < 0;
        boolean otherStartsBeforeThisEnds = maxGt == null || other.minGt.compareTo(maxGt) < 0;
        return thisStartsBeforeOtherEnds && otherStartsBeforeThisEnds;
    }

    @Override
    public BigDecimal lowerBoundGt() {
        return minGt;
    }

    public String describeRange() {
        return "[" + minGt.toPlainString() + ", " + (maxGt == null ? "∞" : maxGt.toPlainString()) + ")";
    }
}
