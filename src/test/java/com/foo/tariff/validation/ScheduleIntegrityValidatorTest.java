package com.foo.tariff.validation;

import static com.foo.tariff.TariffFixtures.exemption;
import static com.foo.tariff.TariffFixtures.fee;
import static com.foo.tariff.TariffFixtures.surcharge;
import static com.foo.tariff.TariffFixtures.tier;
import static org.assertj.core.api.Assertions.assertThat;

import com.foo.tariff.model.Comparison;
import com.foo.tariff.model.EffectivePeriod;
import com.foo.tariff.model.FlagCondition;
import com.foo.tariff.model.OperationalFlag;
import com.foo.tariff.model.RateTier;
import com.foo.tariff.model.RateUnit;
import com.foo.tariff.model.TariffSchedule;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

class ScheduleIntegrityValidatorTest {

    private final ScheduleIntegrityValidator validator = new ScheduleIntegrityValidator();

    @Test
    void contiguousTiers_noProblems() {
        TariffSchedule schedule =
                schedule(
                        List.of(
                                tier("t1", "towage_dues", 0, 2000L, "1.00"),
                                tier("t2", "towage_dues", 2000, 10000L, "0.80"),
                                tier("t3", "towage_dues", 10000, null, "0.60")));

        assertThat(validator.check(schedule)).isEmpty();
    }

    @Test
    void overlappingTiers_reported() {
        TariffSchedule schedule =
                schedule(
                        List.of(
                                tier("t1", "towage_dues", 0, 5000L, "1.00"),
                                tier("t2", "towage_dues", 4000, null, "0.80")));

        assertThat(validator.check(schedule))
                .singleElement()
                .asString()
                .contains("DUR/towage_dues")
                .contains("overlap");
    }

    @Test
    void gapBetweenTiers_reported() {
        TariffSchedule schedule =
                schedule(
                        List.of(
                                tier("t1", "towage_dues", 0, 2000L, "1.00"),
                                tier("t2", "towage_dues", 3000, null, "0.80")));

        assertThat(validator.check(schedule)).singleElement().asString().contains("gap");
    }

    @Test
    void overlappingRangesInDisjointPeriods_allowed() {
        EffectivePeriod nextYear =
                new EffectivePeriod(LocalDate.of(2025, 1, 1), LocalDate.of(2025, 12, 31));
        TariffSchedule schedule =
                schedule(
                        List.of(
                                tier("t-2024", "towage_dues", 0, null, "1.00"),
                                tier("t-2025", "towage_dues", 0, null, "1.10").toBuilder()
                                        .effectivePeriod(nextYear)
                                        .build()));

        assertThat(validator.check(schedule)).isEmpty();
    }

    @Test
    void duplicateRuleIds_reportedOnce() {
        TariffSchedule schedule =
                TariffSchedule.builder()
                        .label("dup")
                        .currency("ZAR")
                        .feeRules(
                                List.of(
                                        fee("dup", "light_dues", "1", RateUnit.PER_GT),
                                        fee("dup", "vts_dues", "1", RateUnit.PER_GT)))
                        .exemptions(List.of(exemption("dup", "light_dues", OperationalFlag.COASTER, "true", "100")))
                        .build();

        assertThat(validator.check(schedule)).containsExactly("duplicate rule_id 'dup'");
    }

    @Test
    void invalidDiscountAndCondition_reported() {
        TariffSchedule schedule =
                TariffSchedule.builder()
                        .label("bad exemption")
                        .currency("ZAR")
                        .feeRules(List.of(fee("light", "light_dues", "1", RateUnit.PER_GT)))
                        .exemptions(
                                List.of(
                                        exemption("zero", "light_dues", OperationalFlag.COASTER, "true", "0"),
                                        exemption("ordering", "light_dues", OperationalFlag.COASTER, "true", "50")
                                                .toBuilder()
                                                .condition(
                                                        FlagCondition.builder()
                                                                .flag(OperationalFlag.COASTER)
                                                                .comparison(Comparison.GT)
                                                                .value("true")
                                                                .build())
                                                .build()))
                        .build();

        assertThat(validator.check(schedule))
                .containsExactly(
                        "zero: discount_percent must be in (0, 100]",
                        "ordering: condition 'is_coaster gt true' does not match the flag type");
    }

    @Test
    void surchargeProblems_reportedAlongsideDuplicateIds() {
        TariffSchedule schedule =
                TariffSchedule.builder()
                        .label("bad surcharge")
                        .currency("ZAR")
                        .feeRules(List.of(fee("pilotage", "pilotage_dues", "1", RateUnit.PER_GT)))
                        .surcharges(
                                List.of(
                                        surcharge("pilotage", "pilotage_dues", OperationalFlag.OUTSIDE_WORKING_HOURS, "true", "50"),
                                        surcharge("negative", "pilotage_dues", OperationalFlag.OUTSIDE_WORKING_HOURS, "true", "-5"),
                                        surcharge("unconditional", "pilotage_dues", OperationalFlag.COASTER, "true", "10")
                                                .toBuilder()
                                                .condition(null)
                                                .build()))
                        .build();

        assertThat(validator.check(schedule))
                .containsExactly(
                        "duplicate rule_id 'pilotage'",
                        "negative: percent must be positive",
                        "unconditional: surcharge requires a condition");
    }

    @Test
    void nonIntegerQuantityFlag_reported() {
        TariffSchedule schedule =
                schedule(
                        List.of(
                                tier("t1", "pilotage_dues", 0, null, "1.00").toBuilder()
                                        .quantityFlag(OperationalFlag.COASTER)
                                        .build()));

        assertThat(validator.check(schedule))
                .containsExactly("t1: quantity flag 'is_coaster' is not an integer flag");
    }

    @Test
    void minAboveMaxAmount_andReversedPeriod_reported() {
        TariffSchedule schedule =
                TariffSchedule.builder()
                        .label("bad fee")
                        .currency("ZAR")
                        .feeRules(
                                List.of(
                                        fee("vts", "vts_dues", "0.65", RateUnit.PER_GT).toBuilder()
                                                .minAmount(new BigDecimal("500"))
                                                .maxAmount(new BigDecimal("100"))
                                                .effectivePeriod(
                                                        new EffectivePeriod(LocalDate.of(2024, 6, 1), LocalDate.of(2024, 1, 1)))
                                                .build()))
                        .build();

        assertThat(validator.check(schedule))
                .containsExactly(
                        "vts: effective_to precedes effective_from", "vts: min_amount exceeds max_amount");
    }

    @Test
    void emptySchedule_reported() {
        TariffSchedule schedule = TariffSchedule.builder().label("empty").currency("ZAR").build();

        assertThat(validator.check(schedule))
                .containsExactly("schedule has no rate tiers or fee rules");
    }

    private static TariffSchedule schedule(List<RateTier> tiers) {
        return TariffSchedule.builder().label("tiers").currency("ZAR").rateTiers(tiers).build();
    }
}
