package com.foo.tariff.exception;

/** 조항 참조 조회 실패. 계산 결과에는 영향을 주지 않으며 설명 참조만 비워진다. */
public class ExplanationUnavailableException extends TariffEngineException {

    public ExplanationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
