package com.foo.tariff.service.resolve;

import com.foo.tariff.exception.AmbiguousTierException;
import com.foo.tariff.model.ExemptionCondition;
import com.foo.tariff.model.FeeRule;
import com.foo.tariff.model.FlagCondition;
import com.foo.tariff.model.RateTier;
import com.foo.tariff.model.ResolvedItem;
import com.foo.tariff.model.SurchargeRule;
import com.foo.tariff.model.TariffSchedule;
import com.foo.tariff.model.VesselProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * 선박 정보에 맞는 구간 요율·요금 규칙과 감면 조건, 할증을 고른다.
 *
 * <p>결과 순서는 요율표의 due type 선언 순서이며, 한 due type 안에서는 구간 요율이 먼저, 요금 규칙은 선언 순서대로
 * 뒤따른다.
 */
@Slf4j
@Component
public class RateResolver {

    public List<ResolvedItem> resolve(TariffSchedule schedule, VesselProfile profile) {
        return resolve(schedule, profile, Set.of());
    }

    /**
     * @param dueTypeFilter 비어 있으면 모든 due type
     * @throws AmbiguousTierException 같은 due type에서 둘 이상의 구간이 적용될 때
     */
    public List<ResolvedItem> resolve(
            TariffSchedule schedule, VesselProfile profile, Set<String> dueTypeFilter) {
        String port = profile.port();
        LocalDate arrivalDate = profile.arrival().toLocalDate();
        List<ResolvedItem> resolved = new ArrayList<>();

        for (String dueType : schedule.dueTypesFor(port)) {
            if (!dueTypeFilter.isEmpty() && !dueTypeFilter.contains(dueType)) {
                continue;
            }

            List<RateTier> matchingTiers =
                    schedule.rateTiersFor(port, dueType).stream()
                            .filter(t -> t.containsTonnage(profile.grossTonnage()))
                            .filter(t -> t.isEffectiveOn(arrivalDate))
                            .toList();
            if (matchingTiers.size() > 1) {
                throw new AmbiguousTierException(
                        schedule.version(),
                        port,
                        dueType,
                        matchingTiers.stream().map(RateTier::ruleId).toList());
            }

            List<FeeRule> applicableFees =
                    schedule.feeRulesFor(port, dueType).stream()
                            .filter(f -> f.isEffectiveOn(arrivalDate))
                            .filter(f -> !excludedByCondition(f, profile))
                            .toList();

            if (matchingTiers.isEmpty() && applicableFees.isEmpty()) {
                log.debug("No applicable rule for {}/{} at {} GT", port, dueType, profile.grossTonnage());
                continue;
            }

            ExemptionCondition exemption = firstSatisfiedExemption(schedule, profile, dueType);
            List<SurchargeRule> surcharges = satisfiedSurcharges(schedule, profile, dueType);
            matchingTiers.forEach(tier -> resolved.add(new ResolvedItem(tier, exemption, surcharges)));
            applicableFees.forEach(fee -> resolved.add(new ResolvedItem(fee, exemption, surcharges)));
        }
        return resolved;
    }

    /**
     * 조건부 요금은 플래그 값이 있고 조건이 거짓일 때만 제외한다. 값이 없거나 타입이 맞지 않으면 그대로 남겨 계산 단계에서
     * 오류로 드러나게 한다.
     */
    private boolean excludedByCondition(FeeRule fee, VesselProfile profile) {
        if (!fee.isConditional() || !fee.condition().isPresentIn(profile.flags())) {
            return false;
        }
        try {
            return !fee.condition().isSatisfiedBy(profile.flagValue(fee.condition().flag()));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private ExemptionCondition firstSatisfiedExemption(
            TariffSchedule schedule, VesselProfile profile, String dueType) {
        LocalDate arrivalDate = profile.arrival().toLocalDate();
        for (ExemptionCondition exemption : schedule.exemptionsFor(profile.port(), dueType)) {
            if (exemption.isEffectiveOn(arrivalDate) && isSatisfied(exemption.condition(), profile)) {
                return exemption;
            }
        }
        return null;
    }

    /** 감면과 달리 할증은 충족된 것을 모두 적용한다. */
    private List<SurchargeRule> satisfiedSurcharges(
            TariffSchedule schedule, VesselProfile profile, String dueType) {
        LocalDate arrivalDate = profile.arrival().toLocalDate();
        return schedule.surchargesFor(profile.port(), dueType).stream()
                .filter(s -> s.isEffectiveOn(arrivalDate))
                .filter(s -> isSatisfied(s.condition(), profile))
                .toList();
    }

    private boolean isSatisfied(FlagCondition condition, VesselProfile profile) {
        if (!condition.isPresentIn(profile.flags())) {
            return false;
        }
        try {
            return condition.isSatisfiedBy(profile.flagValue(condition.flag()));
        } catch (IllegalArgumentException e) {
            log.warn("Flag condition '{}' skipped: {}", condition.describe(), e.getMessage());
            return false;
        }
    }
}
