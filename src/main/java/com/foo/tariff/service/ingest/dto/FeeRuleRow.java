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

/**
 * FeeRules 시트 한 행. 톤수와 무관한 부과금이며, condition_* 컬럼이 채워지면 해당 플래그 조건을 만족할 때만
 * 적용된다.
 */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FeeRuleRow {

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

    @SheetColumn(header = "condition_flag", required = false)
    private String conditionFlag;

    @SheetColumn(header = "condition_op", required = false)
    @Pattern(regexp = RuleRowPatterns.COMPARISON, message = "condition_op는 eq, ne, gt, ge, lt, le 중 하나여야 합니다")
    private String conditionOp;

    @SheetColumn(header = "condition_value", required = false)
    private String conditionValue;

    @SheetColumn(header = "effective_from")
    @NotNull(message = "effective_from은 필수 입력 항목입니다")
    private LocalDate effectiveFrom;

    @SheetColumn(header = "effective_to", required = false)
    private LocalDate effectiveTo;
}
