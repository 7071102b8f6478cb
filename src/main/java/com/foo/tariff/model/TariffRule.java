package com.foo.tariff.model;

import java.math.BigDecimal;
import java.time.LocalDate;

/** 금액을 산출하는 요율 규칙. 구간 요율({@link RateTier})과 비구간 요금({@link FeeRule})이 구현한다. */
public interface TariffRule {

    String ruleId();

    String port();

    String dueType();

    BigDecimal rate();

    RateUnit unit();

    /** 정액 기본료. 없으면 0으로 본다. */
    BigDecimal baseFee();

    BigDecimal minAmount();

    BigDecimal maxAmount();

    String currency();

    /** 금액에 곱할 정수 플래그(예: 작업 횟수). 없으면 1회로 본다. */
    OperationalFlag quantityFlag();

    EffectivePeriod effectivePeriod();

    /** {@code per_100gt_above_min} 계산의 기준 하한. */
    default BigDecimal lowerBoundGt() {
        return BigDecimal.ZERO;
    }

    default boolean isEffectiveOn(LocalDate date) {
        return effectivePeriod().contains(date);
    }
}
