package com.foo.tariff.service.ingest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.foo.tariff.annotation.SheetColumn;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/** RateTiers 시트 한 행(또는 payload의 rate_tiers 원소). 톤수 구간은 [min_gt, max_gt). */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RateTierRow {

    @SheetColumn(header = "rule_id")
    @NotBlank(message = "rule_id는 필수 입력 항목입니다")
    @Size(max = 64, message = "rule_id는 64자 이내로 입력하세요")
    private String ruleId;

    @SheetColumn(header = "port")
    @NotBlank(message = "port는 필수 입력 항목입니다")
    private String port;

    @SheetColumn(header = "due_type")
    @NotBlank(message = "due_type은 필수 입력 항목입니다")
    private String dueType;

    @SheetColumn(header = "min_gt")
    @NotNull(message = "min_gt는 필수 입력 항목입니다")
    @DecimalMin(value = "0", message = "min_gt는 0 이상이어야 합니다")
    private BigDecimal minGt;

    // 비어 있으면 상한 없음
    @SheetColumn(header = "max_gt", required = false)
    @DecimalMin(value = "0", inclusive = false, message = "max_gt는 0보다 커야 합니다")
    private BigDecimal maxGt;

    @SheetColumn(header = "rate")
    @NotNull(message = "rate는 필수 입력 항목입니다")
    @DecimalMin(value = "0", message = "rate는 0 이상이어야 합니다")
    private BigDecimal rate;

    @SheetColumn(header = "unit")
    @NotBlank(message = "unit은 필수 입력 항목입니다")
    @Pattern(regexp = RuleRowPatterns.UNIT, message = "지원하지 않는 unit입니다")
    private String unit;

    @SheetColumn(header = "base_fee", required = false)
    @DecimalMin(value = "0", message = "base_fee는 0 이상이어야 합니다")
    private BigDecimal baseFee;

    @SheetColumn(header = "min_amount", required = false)
    @DecimalMin(value = "0", message = "min_amount는 0 이상이어야 합니다")
    private BigDecimal minAmount;

    @SheetColumn(header = "max_amount", required = false)
    @DecimalMin(value = "0", message = "max_amount는 0 이상이어야 합니다")
    private BigDecimal maxAmount;

    @SheetColumn(header = "currency", required = false)
    @Pattern(regexp = RuleRowPatterns.CURRENCY, message = "currency는 ISO 4217 세 글자 코드여야 합니다")
    private String currency;

    @SheetColumn(header = "quantity_flag", required = false)
    private String quantityFlag;

    @SheetColumn(header = "effective_from")
    @NotNull(message = "effective_from은 필수 입력 항목입니다")
    private LocalDate effectiveFrom;

    @SheetColumn(header = "effective_to", required = false)
    private LocalDate effectiveTo;
}
