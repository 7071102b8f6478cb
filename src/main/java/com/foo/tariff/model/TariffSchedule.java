package com.foo.tariff.model;

import lombok.Builder;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 게시된 요율표 스냅샷. 생성 후 변경되지 않으며, 저장소가 버전을 부여한 뒤에만 조회 대상이 된다.
 *
 * <p>due type 순서는 {@code dueTypeOrder}에 선언된 순서를 먼저 따르고, 선언되지 않은 due type은
 * 구간 요율, 요금 규칙 순으로 처음 등장한 순서를 따른다.
 */
@Builder(toBuilder = true)
public record TariffSchedule(
        long version,
        String label,
        String currency,
        Instant publishedAt,
        List<String> dueTypeOrder,
        List<RateTier> rateTiers,
        List<FeeRule> feeRules,
        List<ExemptionCondition> exemptions,
        List<SurchargeRule> surcharges) {

    public TariffSchedule {
        dueTypeOrder = dueTypeOrder == null ? List.of() : List.copyOf(dueTypeOrder);
        rateTiers = rateTiers == null ? List.of() : List.copyOf(rateTiers);
        feeRules = feeRules == null ? List.of() : List.copyOf(feeRules);
        exemptions = exemptions == null ? List.of() : List.copyOf(exemptions);
        surcharges = surcharges == null ? List.of() : List.copyOf(surcharges);
    }

    public TariffSchedule withPublication(long assignedVersion, Instant publishedAt) {
        return toBuilder().version(assignedVersion).publishedAt(publishedAt).build();
    }

    public Set<String> ports() {
        Set<String> ports = new LinkedHashSet<>();
        rateTiers.forEach(t -> ports.add(t.port()));
        feeRules.forEach(f -> ports.add(f.port()));
        return ports;
    }

    public boolean covers(String port) {
        return ports().stream().anyMatch(p -> p.equalsIgnoreCase(port));
    }

    public List<String> dueTypesFor(String port) {
        Set<String> present = new LinkedHashSet<>();
        Stream.concat(rateTiers.stream(), feeRules.stream())
                .filter(r -> r.port().equalsIgnoreCase(port))
                .forEach(r -> present.add(r.dueType()));

        Set<String> ordered = new LinkedHashSet<>();
        dueTypeOrder.stream().filter(present::contains).forEach(ordered::add);
        ordered.addAll(present);
        return List.copyOf(ordered);
    }

    public List<RateTier> rateTiersFor(String port, String dueType) {
        return rateTiers.stream()
                .filter(t -> t.port().equalsIgnoreCase(port) && t.dueType().equals(dueType))
                .toList();
    }

    public List<FeeRule> feeRulesFor(String port, String dueType) {
        return feeRules.stream()
                .filter(f -> f.port().equalsIgnoreCase(port) && f.dueType().equals(dueType))
                .toList();
    }

    public List<ExemptionCondition> exemptionsFor(String port, String dueType) {
        return exemptions.stream()
                .filter(e -> e.port().equalsIgnoreCase(port) && e.dueType().equals(dueType))
                .toList();
    }

    public List<SurchargeRule> surchargesFor(String port, String dueType) {
        return surcharges.stream()
                .filter(s -> s.port().equalsIgnoreCase(port) && s.dueType().equals(dueType))
                .toList();
    }
}
