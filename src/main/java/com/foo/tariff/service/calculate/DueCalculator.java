package com.foo.tariff.service.calculate;

import com.foo.tariff.exception.DueCalculationException;
import com.foo.tariff.model.DueLineItem;
import com.foo.tariff.model.ExemptionCondition;
import com.foo.tariff.model.FeeRule;
import com.foo.tariff.model.FlagCondition;
import com.foo.tariff.model.OperationalFlag;
import com.foo.tariff.model.RateTier;
import com.foo.tariff.model.ResolvedItem;
import com.foo.tariff.model.SurchargeRule;
import com.foo.tariff.model.TariffRule;
import com.foo.tariff.model.VesselProfile;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;

/**
 * 규칙 하나의 금액을 계산한다.
 *
 * <p>금액 = (기본료 + 요율 × 단위수량) × 작업 횟수. 이후 최소·최대 금액으로 보정하고, 충족된 할증 비율의 합만큼
 * 더한 뒤, 마지막으로 감면을 적용한다. 전액 면제여도 금액 0인 항목을 남긴다.
 */
@Component
public class DueCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public DueLineItem compute(long scheduleVersion, VesselProfile profile, ResolvedItem item) {
        TariffRule rule = item.rule();
        StringBuilder formula = new StringBuilder();

        if (rule instanceof FeeRule fee && fee.isConditional()) {
            requireConditionFlag(scheduleVersion, fee, profile);
        }

        BigDecimal measure = measure(rule, profile, formula);
        BigDecimal amount = rule.rate().multiply(measure);

        BigDecimal baseFee = rule.baseFee();
        if (baseFee != null && baseFee.signum() != 0) {
            amount = baseFee.add(amount);
            formula.insert(0, baseFee.toPlainString() + " + ");
        }

        if (rule.quantityFlag() != null) {
            long quantity = requireQuantity(scheduleVersion, rule, profile);
            amount = amount.multiply(BigDecimal.valueOf(quantity));
            formula.append(" × ").append(quantity).append(" (").append(rule.quantityFlag().getCode()).append(")");
        }

        amount = clamp(rule, amount, formula);
        amount = applySurcharges(item.surcharges(), amount, formula);

        ExemptionCondition exemption = item.exemption();
        if (exemption != null) {
            if (exemption.isFullExemption()) {
                amount = BigDecimal.ZERO;
                formula.append(" → exempt");
            } else {
                BigDecimal remaining = HUNDRED.subtract(exemption.discountPercent());
                amount = amount.multiply(remaining).divide(HUNDRED);
                formula.append(" less ").append(exemption.discountPercent().toPlainString()).append('%');
            }
        }

        return DueLineItem.builder()
                .dueType(rule.dueType())
                .ruleId(rule.ruleId())
                .tierApplied(rule instanceof RateTier tier ? tier.describeRange() : null)
                .unit(rule.unit())
                .baseAmount(amount)
                .currency(rule.currency())
                .surchargesApplied(item.surcharges().isEmpty()
                        ? null
                        : item.surcharges().stream().map(SurchargeRule::ruleId).toList())
                .exemptionApplied(exemption != null ? exemption.ruleId() : null)
                .exemptionReason(exemption != null ? exemption.reason() : null)
                .formula(formula.toString())
                .build();
    }

    /** 입항부터 출항까지의 일수. 하루 미만은 올림하고 최소 1일. */
    public static long stayDays(VesselProfile profile) {
        Duration stay = Duration.between(profile.arrival(), profile.departure());
        long days = stay.toDays();
        if (stay.compareTo(Duration.ofDays(days)) > 0) {
            days++;
        }
        return Math.max(1, days);
    }

    private BigDecimal measure(TariffRule rule, VesselProfile profile, StringBuilder formula) {
        BigDecimal gt = profile.grossTonnage();
        String rate = rule.rate().toPlainString();
        switch (rule.unit()) {
            case FLAT -> {
                formula.append(rate).append(" flat");
                return BigDecimal.ONE;
            }
            case PER_GT -> {
                formula.append(rate).append(" × ").append(gt.toPlainString()).append(" GT");
                return gt;
            }
            case PER_GT_PER_DAY -> {
                long days = stayDays(profile);
                formula.append(rate).append(" × ").append(gt.toPlainString()).append(" GT × ")
                        .append(days).append(" day(s)");
                return gt.multiply(BigDecimal.valueOf(days));
            }
            case PER_100GT -> {
                BigDecimal units = hundredUnits(gt);
                formula.append(rate).append(" × ").append(units.toPlainString()).append(" (100 GT units)");
                return units;
            }
            case PER_100GT_PER_DAY -> {
                BigDecimal units = hundredUnits(gt);
                long days = stayDays(profile);
                formula.append(rate).append(" × ").append(units.toPlainString()).append(" (100 GT units) × ")
                        .append(days).append(" day(s)");
                return units.multiply(BigDecimal.valueOf(days));
            }
            case PER_100GT_ABOVE_MIN -> {
                BigDecimal above = gt.subtract(rule.lowerBoundGt()).max(BigDecimal.ZERO);
                BigDecimal units = hundredUnits(above);
                formula.append(rate).append(" × ").append(units.toPlainString())
                        .append(" (100 GT units above ").append(rule.lowerBoundGt().toPlainString()).append(')');
                return units;
            }
            default -> throw new IllegalStateException("Unhandled unit: " + rule.unit());
        }
    }

    private static BigDecimal hundredUnits(BigDecimal tonnage) {
        return tonnage.divide(HUNDRED, 0, RoundingMode.CEILING);
    }

    private BigDecimal applySurcharges(List<SurchargeRule> surcharges, BigDecimal amount, StringBuilder formula) {
        if (surcharges.isEmpty()) {
            return amount;
        }
        BigDecimal percent = BigDecimal.ZERO;
        for (SurchargeRule surcharge : surcharges) {
            percent = percent.add(surcharge.percent());
            formula.append(" plus ").append(surcharge.percent().toPlainString()).append("% (")
                    .append(surcharge.ruleId()).append(')');
        }
        return amount.multiply(HUNDRED.add(percent)).divide(HUNDRED);
    }

    private BigDecimal clamp(TariffRule rule, BigDecimal amount, StringBuilder formula) {
        if (rule.minAmount() != null && amount.compareTo(rule.minAmount()) < 0) {
            formula.append(", min ").append(rule.minAmount().toPlainString()).append(" applied");
            return rule.minAmount();
        }
        if (rule.maxAmount() != null && amount.compareTo(rule.maxAmount()) > 0) {
            formula.append(", max ").append(rule.maxAmount().toPlainString()).append(" applied");
            return rule.maxAmount();
        }
        return amount;
    }

    private void requireConditionFlag(long scheduleVersion, FeeRule fee, VesselProfile profile) {
        FlagCondition condition = fee.condition();
        if (!profile.hasFlag(condition.flag())) {
            throw new DueCalculationException(
                    scheduleVersion,
                    fee.ruleId(),
                    "Conditional fee %s requires flag '%s'".formatted(fee.ruleId(), condition.flag().getCode()));
        }
        try {
            condition.isSatisfiedBy(profile.flagValue(condition.flag()));
        } catch (IllegalArgumentException e) {
            throw new DueCalculationException(scheduleVersion, fee.ruleId(), e.getMessage(), e);
        }
    }

    private long requireQuantity(long scheduleVersion, TariffRule rule, VesselProfile profile) {
        OperationalFlag flag = rule.quantityFlag();
        Object value = profile.flagValue(flag);
        if (value == null) {
            throw new DueCalculationException(
                    scheduleVersion,
                    rule.ruleId(),
                    "Rule %s requires flag '%s'".formatted(rule.ruleId(), flag.getCode()));
        }
        if (!(value instanceof Integer || value instanceof Long)) {
            throw new DueCalculationException(
                    scheduleVersion,
                    rule.ruleId(),
                    "Rule %s expects an integer '%s' but was %s"
                            .formatted(rule.ruleId(), flag.getCode(), value.getClass().getSimpleName()));
        }
        return ((Number) value).longValue();
    }
}
