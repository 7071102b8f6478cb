package com.foo.tariff.service.ingest;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.foo.tariff.model.TariffSchedule;

import java.time.Instant;
import java.util.List;

/** 게시된 스냅샷의 요약. 게시 응답과 스냅샷 목록에 쓴다. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScheduleSummary(
        long version,
        String label,
        String currency,
        Instant publishedAt,
        List<String> ports,
        int rateTierCount,
        int feeRuleCount,
        int exemptionCount,
        int surchargeCount) {

    public static ScheduleSummary of(TariffSchedule schedule) {
        return new ScheduleSummary(
                schedule.version(),
                schedule.label(),
                schedule.currency(),
                schedule.publishedAt(),
                List.copyOf(schedule.ports()),
                schedule.rateTiers().size(),
                schedule.feeRules().size(),
                schedule.exemptions().size(),
                schedule.surcharges().size());
    }
}
