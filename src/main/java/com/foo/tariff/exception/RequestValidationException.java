package com.foo.tariff.exception;

import lombok.Getter;

/** 요청 필드가 누락되었거나 형식·범위를 벗어났을 때. 호출자에게 필드와 제약을 그대로 알린다. */
@Getter
public class RequestValidationException extends TariffEngineException {

    private final String field;
    private final String constraint;

    public RequestValidationException(String field, String constraint, String message) {
        super(message);
        this.field = field;
        this.constraint = constraint;
    }
}
