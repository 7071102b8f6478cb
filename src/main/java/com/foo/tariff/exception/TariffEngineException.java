package com.foo.tariff.exception;

/** 요율 계산 엔진에서 발생하는 모든 유형화된 오류의 상위 타입. */
public abstract class TariffEngineException extends RuntimeException {

    protected TariffEngineException(String message) {
        super(message);
    }

    protected TariffEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
