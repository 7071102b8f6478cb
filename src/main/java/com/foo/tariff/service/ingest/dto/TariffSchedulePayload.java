package com.foo.tariff.service.ingest.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/** JSON으로 게시하는 요율표. 워크북 업로드도 같은 구조로 모은 뒤 게시한다. */
@Data
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TariffSchedulePayload {

    @NotBlank(message = "label은 필수 입력 항목입니다")
    private String label;

    @Pattern(regexp = RuleRowPatterns.CURRENCY, message = "currency는 ISO 4217 세 글자 코드여야 합니다")
    private String currency;

    private List<String> dueTypeOrder = new ArrayList<>();
    private List<RateTierRow> rateTiers = new ArrayList<>();
    private List<FeeRuleRow> feeRules = new ArrayList<>();
    private List<ExemptionRow> exemptions = new ArrayList<>();
    private List<SurchargeRow> surcharges = new ArrayList<>();
}
