package com.foo.tariff.service.explanation;

import com.foo.tariff.config.TariffEngineProperties;
import com.foo.tariff.exception.ExplanationUnavailableException;
import com.foo.tariff.model.DueLineItem;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 계산 항목의 rule_id(적용된 감면 규칙 포함)를 외부 조항 참조에 연결한다. 텍스트를 만들지 않는 단순 조회 조인이다.
 *
 * <p>조회는 별도 실행기에서 제한 시간 안에만 기다린다. 실패하거나 시간을 넘기면 빈 결과를 돌려주며 계산을 실패시키지
 * 않는다.
 */
@Slf4j
@Component
public class ExplanationAnchor {

    private final ClauseReferenceSource referenceSource;
    private final Executor executor;
    private final TariffEngineProperties properties;

    public ExplanationAnchor(
            ClauseReferenceSource referenceSource,
            @Qualifier("explanationExecutor") Executor executor,
            TariffEngineProperties properties) {
        this.referenceSource = referenceSource;
        this.executor = executor;
        this.properties = properties;
    }

    public Map<String, String> anchor(List<DueLineItem> items, boolean includeExplanation) {
        if (!includeExplanation || items.isEmpty()) {
            return Map.of();
        }
        List<String> ruleIds = collectRuleIds(items);
        try {
            return fetch(ruleIds);
        } catch (ExplanationUnavailableException e) {
            log.warn("조항 참조 없이 결과를 반환합니다: {}", e.getMessage());
            return Map.of();
        }
    }

    private Map<String, String> fetch(List<String> ruleIds) {
        CompletableFuture<Map<String, String>> future;
        try {
            future = CompletableFuture.supplyAsync(() -> referenceSource.lookup(ruleIds), executor);
        } catch (RejectedExecutionException e) {
            throw new ExplanationUnavailableException("clause lookup rejected by executor", e);
        }
        try {
            Map<String, String> found =
                    future.get(properties.getExplanationTimeoutMs(), TimeUnit.MILLISECONDS);
            return orderByRuleIds(ruleIds, found);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExplanationUnavailableException(
                    "clause lookup exceeded " + properties.getExplanationTimeoutMs() + "ms", e);
        } catch (ExecutionException e) {
            throw new ExplanationUnavailableException("clause lookup failed: " + e.getCause(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExplanationUnavailableException("clause lookup interrupted", e);
        }
    }

    private static List<String> collectRuleIds(List<DueLineItem> items) {
        Set<String> ruleIds = new LinkedHashSet<>();
        for (DueLineItem item : items) {
            ruleIds.add(item.ruleId());
            if (item.surchargesApplied() != null) {
                ruleIds.addAll(item.surchargesApplied());
            }
            if (item.exemptionApplied() != null) {
                ruleIds.add(item.exemptionApplied());
            }
        }
        return new ArrayList<>(ruleIds);
    }

    private static Map<String, String> orderByRuleIds(List<String> ruleIds, Map<String, String> found) {
        Map<String, String> ordered = new LinkedHashMap<>();
        if (found == null) {
            return ordered;
        }
        for (String ruleId : ruleIds) {
            String reference = found.get(ruleId);
            if (reference != null) {
                ordered.put(ruleId, reference);
            }
        }
        return ordered;
    }
}
