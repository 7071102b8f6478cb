package com.foo.tariff.service.guardrail;

import com.foo.tariff.config.TariffEngineProperties;
import com.foo.tariff.config.TariffEngineProperties.AmountRange;
import com.foo.tariff.config.TariffEngineProperties.ResultCheck;
import com.foo.tariff.model.CalculationRequest;
import com.foo.tariff.model.DueLineItem;
import com.foo.tariff.service.aggregate.DueAggregator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 합계가 끝난 계산 결과를 설정된 기준과 비교해 경고 문구를 만든다. 결과 금액은 바꾸지 않는다.
 *
 * <p>전액 면제된 due type은 금액 범위와 최저 부과액 점검에서 뺀다.
 */
@Component
@RequiredArgsConstructor
public class ResultSanityChecker {

    private final TariffEngineProperties properties;

    public List<String> check(
            CalculationRequest request, List<DueLineItem> items, Map<String, BigDecimal> totals) {
        ResultCheck limits = properties.getResultCheck();
        List<String> warnings = new ArrayList<>();

        BigDecimal grossTonnage = request.profile().grossTonnage();
        if (grossTonnage.compareTo(limits.getLargeGrossTonnage()) > 0) {
            warnings.add("gross_tonnage %s이(가) %s를 넘습니다. 선박 톤수를 확인하세요."
                    .formatted(grossTonnage.toPlainString(), limits.getLargeGrossTonnage().toPlainString()));
        }

        if (items.isEmpty()) {
            warnings.add("계산된 항만 요금이 없습니다.");
        }

        checkCompulsory(request, items, limits, warnings);

        dueTotals(items).forEach((dueType, amount) -> {
            AmountRange range = limits.getDueRanges().get(dueType);
            if (range != null && range.getMin() != null && amount.compareTo(range.getMin()) < 0) {
                warnings.add("%s 금액 %s이(가) 예상 최소 %s보다 작습니다."
                        .formatted(dueType, amount.toPlainString(), range.getMin().toPlainString()));
            } else if (range != null && range.getMax() != null && amount.compareTo(range.getMax()) > 0) {
                warnings.add("%s 금액 %s이(가) 예상 최대 %s를 넘습니다."
                        .formatted(dueType, amount.toPlainString(), range.getMax().toPlainString()));
            }
            BigDecimal minimum = limits.getDueMinimums().get(dueType);
            if (minimum != null && amount.compareTo(minimum) < 0) {
                warnings.add("%s 금액 %s이(가) 최저 부과액 %s보다 작습니다."
                        .formatted(dueType, amount.toPlainString(), minimum.toPlainString()));
            }
        });

        totals.forEach((currency, total) -> {
            if (total.compareTo(limits.getMaxTotal()) > 0) {
                warnings.add("%s 합계 %s이(가) %s를 넘습니다. 입력값을 확인하세요."
                        .formatted(currency, total.toPlainString(), limits.getMaxTotal().toPlainString()));
            }
        });
        return warnings;
    }

    private void checkCompulsory(
            CalculationRequest request, List<DueLineItem> items, ResultCheck limits, List<String> warnings) {
        String port = request.profile().port();
        limits.getCompulsoryDueTypes().forEach((configuredPort, dueTypes) -> {
            if (!configuredPort.equalsIgnoreCase(port)) {
                return;
            }
            for (String dueType : dueTypes) {
                boolean requested = request.dueTypes().isEmpty() || request.dueTypes().contains(dueType);
                boolean calculated = items.stream().anyMatch(i -> i.dueType().equals(dueType));
                if (requested && !calculated) {
                    warnings.add("%s 항구는 %s 부과 대상이지만 계산된 항목이 없습니다.".formatted(port, dueType));
                }
            }
        });
    }

    /** due type별 금액 합계. 모든 항목이 전액 면제된 due type은 빠진다. */
    private static Map<String, BigDecimal> dueTotals(List<DueLineItem> items) {
        Map<String, BigDecimal> sums = new LinkedHashMap<>();
        Map<String, Boolean> charged = new LinkedHashMap<>();
        for (DueLineItem item : items) {
            sums.merge(item.dueType(), DueAggregator.round(item.baseAmount()), BigDecimal::add);
            boolean fullyExempt = item.exemptionApplied() != null && item.baseAmount().signum() == 0;
            charged.merge(item.dueType(), !fullyExempt, Boolean::logicalOr);
        }
        sums.keySet().removeIf(dueType -> !charged.get(dueType));
        return sums;
    }
}
