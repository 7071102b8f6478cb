package com.foo.tariff.service;

import com.foo.tariff.model.CalculationRequest;
import com.foo.tariff.model.CalculationResult;
import com.foo.tariff.model.DueLineItem;
import com.foo.tariff.model.ResolvedItem;
import com.foo.tariff.model.TariffSchedule;
import com.foo.tariff.model.VesselProfile;
import com.foo.tariff.repository.TariffRepository;
import com.foo.tariff.service.aggregate.DueAggregator;
import com.foo.tariff.service.calculate.DueCalculator;
import com.foo.tariff.service.explanation.ExplanationAnchor;
import com.foo.tariff.service.guardrail.GuardrailValidator;
import com.foo.tariff.service.guardrail.RawCalculationRequest;
import com.foo.tariff.service.guardrail.ResultSanityChecker;
import com.foo.tariff.service.resolve.RateResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * 계산 요청 처리 흐름: 검증 → 스냅샷 조회 → 규칙 선택 → 금액 계산 → 통화별 합계 → 결과 점검 → (선택) 조항 참조 연결.
 *
 * <p>검증·선택·계산 단계의 오류는 그대로 전파되며 부분 결과는 반환하지 않는다. 조항 참조 단계는 실패해도 합계가 끝난
 * 결과를 되돌리지 않는다. 결과 점검은 경고만 남긴다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PortDuesCalculationService {

    private final GuardrailValidator guardrailValidator;
    private final TariffRepository repository;
    private final RateResolver rateResolver;
    private final DueCalculator dueCalculator;
    private final DueAggregator aggregator;
    private final ResultSanityChecker sanityChecker;
    private final ExplanationAnchor explanationAnchor;

    public CalculationResult calculate(RawCalculationRequest rawRequest) {
        log.debug("Stage {}", CalculationStage.RECEIVED);
        CalculationRequest request = guardrailValidator.validate(rawRequest);
        log.debug("Stage {}: port={}", CalculationStage.VALIDATED, request.profile().port());
        return calculate(request);
    }

    /** 이미 가드레일을 통과한 요청을 계산한다. */
    public CalculationResult calculate(CalculationRequest request) {
        VesselProfile profile = request.profile();
        TariffSchedule schedule = repository.getSnapshot(profile.port(), request.scheduleVersion());

        List<ResolvedItem> resolved = rateResolver.resolve(schedule, profile, request.dueTypes());
        log.debug("Stage {}: {} item(s) from schedule v{}",
                CalculationStage.RESOLVED, resolved.size(), schedule.version());

        List<DueLineItem> items =
                resolved.stream()
                        .map(item -> dueCalculator.compute(schedule.version(), profile, item))
                        .toList();
        log.debug("Stage {}", CalculationStage.COMPUTED);

        Map<String, BigDecimal> totals = aggregator.aggregate(items);
        log.debug("Stage {}: totals={}", CalculationStage.AGGREGATED, totals);

        List<String> warnings = sanityChecker.check(request, items, totals);
        if (!warnings.isEmpty()) {
            log.warn("Result check for {} raised {} warning(s): {}", profile.port(), warnings.size(), warnings);
        }

        Map<String, String> explanationRefs =
                explanationAnchor.anchor(items, request.includeExplanation());
        if (request.includeExplanation()) {
            log.debug("Stage {}: {} reference(s)", CalculationStage.EXPLAINED, explanationRefs.size());
        }

        CalculationResult result =
                CalculationResult.builder()
                        .port(profile.port())
                        .vesselName(profile.vesselName())
                        .scheduleVersion(schedule.version())
                        .lineItems(items)
                        .totals(totals)
                        .explanationRefs(explanationRefs)
                        .warnings(warnings)
                        .build();
        log.info(
                "Calculated {} due(s) for {} ({} GT) against schedule v{}: {}",
                items.size(),
                profile.port(),
                profile.grossTonnage().toPlainString(),
                schedule.version(),
                totals);
        log.debug("Stage {}", CalculationStage.COMPLETED);
        return result;
    }
}
