package com.foo.tariff.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/** 한 셀(또는 JSON 필드)의 오류. JSON payload에서 온 행은 columnLetter가 없다. */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CellError(
        String columnLetter, String fieldName, String headerName, Object rejectedValue, String message) {}
