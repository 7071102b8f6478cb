package com.foo.tariff.service.guardrail;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 검증 전 계산 요청. API 입력이든 외부 파서(자연어 등)의 출력이든 모두 이 형태로 들어와 같은 가드레일을 거친다.
 *
 * <p>숫자·날짜 필드는 원문 그대로 받아 가드레일에서 해석한다.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@Data
@NoArgsConstructor
public class RawCalculationRequest {

    @NotBlank(message = "required")
    private String port;

    private String vesselName;

    @NotBlank(message = "required")
    private String grossTonnage;

    @NotBlank(message = "required")
    private String arrivalDate;

    @NotBlank(message = "required")
    private String departureDate;

    private Map<String, Object> flags = new LinkedHashMap<>();

    private boolean includeExplanation;

    private Long scheduleVersion;

    private List<String> dueTypes;
}
