package com.foo.tariff.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DueLineItem(
        String dueType,
        String ruleId,
        String tierApplied,
        RateUnit unit,
        BigDecimal baseAmount,
        String currency,
        List<String> surchargesApplied,
        String exemptionApplied,
        String exemptionReason,
        String formula) {}
