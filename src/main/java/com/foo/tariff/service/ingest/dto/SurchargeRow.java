package com.foo.tariff.service.ingest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.foo.tariff.annotation.SheetColumn;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDate;

/** Surcharges 시트 한 행. */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class SurchargeRow {

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

    @SheetColumn(header = "condition_flag")
    @NotBlank(message = "condition_flag는 필수 입력 항목입니다")
    private String conditionFlag;

    @SheetColumn(header = "condition_op", required = false)
    @Pattern(regexp = RuleRowPatterns.COMPARISON, message = "condition_op는 eq, ne, gt, ge, lt, le 중 하나여야 합니다")
    private String conditionOp;

    @SheetColumn(header = "condition_value")
    @NotBlank(message = "condition_value는 필수 입력 항목입니다")
    private String conditionValue;

    @SheetColumn(header = "percent")
    @NotNull(message = "percent는 필수 입력 항목입니다")
    @DecimalMin(value = "0", inclusive = false, message = "percent는 0보다 커야 합니다")
    @DecimalMax(value = "1000", message = "percent는 1000 이하여야 합니다")
    private BigDecimal percent;

    @SheetColumn(header = "reason")
    @NotBlank(message = "reason은 필수 입력 항목입니다")
    @Size(max = 200, message = "reason은 200자 이내로 입력하세요")
    private String reason;

    @SheetColumn(header = "effective_from")
    @NotNull(message = "effective_from은 필수 입력 항목입니다")
    private LocalDate effectiveFrom;

    @SheetColumn(header = "effective_to", required = false)
    private LocalDate effectiveTo;
}
