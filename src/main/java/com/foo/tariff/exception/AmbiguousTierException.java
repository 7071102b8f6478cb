package com.foo.tariff.exception;

import lombok.Getter;

import java.util.List;

/**
 * 한 due type에 두 개 이상의 구간이 동시에 적용되는 경우. 요청이 아니라 요율표 데이터의 결함이다.
 */
@Getter
public class AmbiguousTierException extends TariffEngineException {

    private final long scheduleVersion;
    private final String port;
    private final String dueType;
    private final List<String> ruleIds;

    public AmbiguousTierException(
            long scheduleVersion, String port, String dueType, List<String> ruleIds) {
        super(
                "Schedule v%d has %d overlapping tiers for %s/%s: %s"
                        .formatted(scheduleVersion, ruleIds.size(), port, dueType, ruleIds));
        this.scheduleVersion = scheduleVersion;
        this.port = port;
        this.dueType = dueType;
        this.ruleIds = List.copyOf(ruleIds);
    }
}
