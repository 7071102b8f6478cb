package com.foo.tariff.service.ingest;

import com.foo.tariff.exception.TariffEngineException;
import lombok.Getter;

import java.util.List;

/** 워크북 시트의 헤더 행에서 필수 컬럼을 찾지 못했을 때. 행 단위 검증 전에 업로드 전체를 거부한다. */
@Getter
public class ColumnResolutionException extends TariffEngineException {

    private final String sheet;
    private final List<String> missingHeaders;

    public ColumnResolutionException(String sheet, List<String> missingHeaders) {
        super(
                "Sheet '%s' is missing required column(s) %s".formatted(sheet, missingHeaders));
        this.sheet = sheet;
        this.missingHeaders = List.copyOf(missingHeaders);
    }

    public String toKoreanMessage() {
        return "'%s' 시트에서 필수 컬럼을 찾을 수 없습니다: %s"
                .formatted(sheet, String.join(", ", missingHeaders));
    }
}
