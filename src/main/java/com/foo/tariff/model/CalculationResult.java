package com.foo.tariff.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Builder
public record CalculationResult(
        String port,
        String vesselName,
        long scheduleVersion,
        List<DueLineItem> lineItems,
        Map<String, BigDecimal> totals,
        Map<String, String> explanationRefs,
        List<String> warnings) {

    public CalculationResult {
        lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
        totals = totals == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(totals));
        explanationRefs =
                explanationRefs == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(explanationRefs));
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
