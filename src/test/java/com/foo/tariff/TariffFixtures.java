package com.foo.tariff;

import com.foo.tariff.model.Comparison;
import com.foo.tariff.model.EffectivePeriod;
import com.foo.tariff.model.ExemptionCondition;
import com.foo.tariff.model.FeeRule;
import com.foo.tariff.model.FlagCondition;
import com.foo.tariff.model.OperationalFlag;
import com.foo.tariff.model.RateTier;
import com.foo.tariff.model.RateUnit;
import com.foo.tariff.model.SurchargeRule;
import com.foo.tariff.model.VesselProfile;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Map;

/** 테스트용 요율표 규칙과 선박 정보. */
public final class TariffFixtures {

    public static final EffectivePeriod FY2024 =
            new EffectivePeriod(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 12, 31));

    private TariffFixtures() {}

    public static RateTier tier(String ruleId, String dueType, long minGt, Long maxGt, String rate) {
        return RateTier.builder()
                .ruleId(ruleId)
                .port("DUR")
                .dueType(dueType)
                .minGt(BigDecimal.valueOf(minGt))
                .maxGt(maxGt == null ? null : BigDecimal.valueOf(maxGt))
                .rate(new BigDecimal(rate))
                .unit(RateUnit.PER_GT)
                .currency("ZAR")
                .effectivePeriod(FY2024)
                .build();
    }

    public static FeeRule fee(String ruleId, String dueType, String rate, RateUnit unit) {
        return FeeRule.builder()
                .ruleId(ruleId)
                .port("DUR")
                .dueType(dueType)
                .rate(new BigDecimal(rate))
                .unit(unit)
                .currency("ZAR")
                .effectivePeriod(FY2024)
                .build();
    }

    public static ExemptionCondition exemption(
            String ruleId, String dueType, OperationalFlag flag, String value, String discountPercent) {
        return ExemptionCondition.builder()
                .ruleId(ruleId)
                .port("DUR")
                .dueType(dueType)
                .condition(
                        FlagCondition.builder().flag(flag).comparison(Comparison.EQ).value(value).build())
                .discountPercent(new BigDecimal(discountPercent))
                .reason(ruleId + " reason")
                .effectivePeriod(FY2024)
                .build();
    }

    public static SurchargeRule surcharge(
            String ruleId, String dueType, OperationalFlag flag, String value, String percent) {
        return SurchargeRule.builder()
                .ruleId(ruleId)
                .port("DUR")
                .dueType(dueType)
                .condition(
                        FlagCondition.builder().flag(flag).comparison(Comparison.EQ).value(value).build())
                .percent(new BigDecimal(percent))
                .reason(ruleId + " reason")
                .effectivePeriod(FY2024)
                .build();
    }

    public static VesselProfile vessel(String grossTonnage, Map<OperationalFlag, Object> flags) {
        return VesselProfile.builder()
                .port("DUR")
                .vesselName("TEST VESSEL")
                .grossTonnage(new BigDecimal(grossTonnage))
                .arrival(LocalDateTime.of(2024, 1, 10, 0, 0))
                .departure(LocalDateTime.of(2024, 1, 13, 0, 0))
                .flags(flags)
                .build();
    }
}
