package com.foo.tariff.validation;

import com.foo.tariff.model.EffectivePeriod;
import com.foo.tariff.model.ExemptionCondition;
import com.foo.tariff.model.FeeRule;
import com.foo.tariff.model.FlagType;
import com.foo.tariff.model.RateTier;
import com.foo.tariff.model.SurchargeRule;
import com.foo.tariff.model.TariffRule;
import com.foo.tariff.model.TariffSchedule;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 게시 전 요율표 정합성 검사. 행 단위 형식 검증을 통과한 뒤에도 행 사이의 관계(구간 중복, 구간 공백, 중복 rule_id)는
 * 여기서만 확인할 수 있다.
 */
@Component
public class ScheduleIntegrityValidator {

    public List<String> check(TariffSchedule schedule) {
        List<String> problems = new ArrayList<>();

        if (schedule.rateTiers().isEmpty() && schedule.feeRules().isEmpty()) {
            problems.add("schedule has no rate tiers or fee rules");
            return problems;
        }

        checkRuleIdsUnique(schedule, problems);
        schedule.rateTiers().forEach(tier -> checkTier(tier, problems));
        schedule.feeRules().forEach(fee -> checkFee(fee, problems));
        schedule.exemptions().forEach(exemption -> checkExemption(exemption, problems));
        schedule.surcharges().forEach(surcharge -> checkSurcharge(surcharge, problems));
        checkTierPartition(schedule, problems);
        return problems;
    }

    private void checkRuleIdsUnique(TariffSchedule schedule, List<String> problems) {
        Set<String> seen = new HashSet<>();
        Stream.concat(
                        Stream.concat(schedule.rateTiers().stream(), schedule.feeRules().stream())
                                .map(TariffRule::ruleId),
                        Stream.concat(
                                schedule.exemptions().stream().map(ExemptionCondition::ruleId),
                                schedule.surcharges().stream().map(SurchargeRule::ruleId)))
                .filter(id -> !seen.add(id))
                .distinct()
                .forEach(id -> problems.add("duplicate rule_id '%s'".formatted(id)));
    }

    private void checkTier(RateTier tier, List<String> problems) {
        if (tier.maxGt() != null && tier.maxGt().compareTo(tier.minGt()) <= 0) {
            problems.add("%s: max_gt must be greater than min_gt".formatted(tier.ruleId()));
        }
        checkRule(tier, problems);
    }

    private void checkFee(FeeRule fee, List<String> problems) {
        checkRule(fee, problems);
        if (fee.isConditional() && !fee.condition().isWellFormed()) {
            problems.add(
                    "%s: condition '%s' does not match the flag type"
                            .formatted(fee.ruleId(), fee.condition().describe()));
        }
    }

    private void checkRule(TariffRule rule, List<String> problems) {
        if (!rule.effectivePeriod().isOrdered()) {
            problems.add("%s: effective_to precedes effective_from".formatted(rule.ruleId()));
        }
        if (rule.minAmount() != null
                && rule.maxAmount() != null
                && rule.minAmount().compareTo(rule.maxAmount()) > 0) {
            problems.add("%s: min_amount exceeds max_amount".formatted(rule.ruleId()));
        }
        if (rule.quantityFlag() != null && rule.quantityFlag().getType() != FlagType.INTEGER) {
            problems.add(
                    "%s: quantity flag '%s' is not an integer flag"
                            .formatted(rule.ruleId(), rule.quantityFlag().getCode()));
        }
    }

    private void checkExemption(ExemptionCondition exemption, List<String> problems) {
        if (!exemption.effectivePeriod().isOrdered()) {
            problems.add("%s: effective_to precedes effective_from".formatted(exemption.ruleId()));
        }
        BigDecimal discount = exemption.discountPercent();
        if (discount.signum() <= 0 || discount.compareTo(ExemptionCondition.FULL_EXEMPTION) > 0) {
            problems.add("%s: discount_percent must be in (0, 100]".formatted(exemption.ruleId()));
        }
        if (!exemption.condition().isWellFormed()) {
            problems.add(
                    "%s: condition '%s' does not match the flag type"
                            .formatted(exemption.ruleId(), exemption.condition().describe()));
        }
    }

    private void checkSurcharge(SurchargeRule surcharge, List<String> problems) {
        if (!surcharge.effectivePeriod().isOrdered()) {
            problems.add("%s: effective_to precedes effective_from".formatted(surcharge.ruleId()));
        }
        if (surcharge.percent() == null || surcharge.percent().signum() <= 0) {
            problems.add("%s: percent must be positive".formatted(surcharge.ruleId()));
        }
        if (surcharge.condition() == null) {
            problems.add("%s: surcharge requires a condition".formatted(surcharge.ruleId()));
        } else if (!surcharge.condition().isWellFormed()) {
            problems.add(
                    "%s: condition '%s' does not match the flag type"
                            .formatted(surcharge.ruleId(), surcharge.condition().describe()));
        }
    }

    /**
     * 같은 항구·due type 안에서 시행 기간이 겹치는 구간끼리는 톤수 범위가 겹치면 안 되고, 시행 기간이 같은 구간들은
     * 빈틈 없이 이어져야 한다.
     */
    private void checkTierPartition(TariffSchedule schedule, List<String> problems) {
        Map<String, List<RateTier>> byPortAndDueType = new LinkedHashMap<>();
        for (RateTier tier : schedule.rateTiers()) {
            String key = tier.port().toUpperCase() + "/" + tier.dueType();
            byPortAndDueType.computeIfAbsent(key, k -> new ArrayList<>()).add(tier);
        }

        byPortAndDueType.forEach(
                (key, tiers) -> {
                    for (int i = 0; i < tiers.size(); i++) {
                        for (int j = i + 1; j < tiers.size(); j++) {
                            RateTier a = tiers.get(i);
                            RateTier b = tiers.get(j);
                            if (a.effectivePeriod().overlaps(b.effectivePeriod()) && a.overlapsTonnage(b)) {
                                problems.add(
                                        "%s: tiers %s %s and %s %s overlap"
                                                .formatted(
                                                        key, a.ruleId(), a.describeRange(), b.ruleId(), b.describeRange()));
                            }
                        }
                    }

                    Map<EffectivePeriod, List<RateTier>> byPeriod = new LinkedHashMap<>();
                    tiers.forEach(t -> byPeriod.computeIfAbsent(t.effectivePeriod(), p -> new ArrayList<>()).add(t));
                    byPeriod.values().forEach(window -> checkContiguous(key, window, problems));
                });
    }

    private void checkContiguous(String key, List<RateTier> window, List<String> problems) {
        List<RateTier> sorted =
                window.stream().sorted(Comparator.comparing(RateTier::minGt)).toList();
        for (int i = 1; i < sorted.size(); i++) {
            RateTier previous = sorted.get(i - 1);
            RateTier next = sorted.get(i);
            if (previous.maxGt() == null) {
                continue;
            }
            if (previous.maxGt().compareTo(next.minGt()) < 0) {
                problems.add(
                        "%s: gap between %s %s and %s %s"
                                .formatted(
                                        key,
                                        previous.ruleId(),
                                        previous.describeRange(),
                                        next.ruleId(),
                                        next.describeRange()));
            }
        }
    }
}
