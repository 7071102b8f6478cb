package com.foo.tariff.exception;

import lombok.Getter;

@Getter
public class DueCalculationException extends TariffEngineException {

    private final long scheduleVersion;
    private final String ruleId;

    public DueCalculationException(long scheduleVersion, String ruleId, String message) {
        super(message);
        this.scheduleVersion = scheduleVersion;
        this.ruleId = ruleId;
    }

    public DueCalculationException(
            long scheduleVersion, String ruleId, String message, Throwable cause) {
        super(message, cause);
        this.scheduleVersion = scheduleVersion;
        this.ruleId = ruleId;
    }
}
