package com.foo.tariff.model;

import java.time.LocalDate;

/** 시행 기간. 시작일과 종료일 모두 포함하며, 종료일이 없으면 무기한. */
public record EffectivePeriod(LocalDate from, LocalDate to) {

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && (to == null || !date.isAfter(to));
    }

    public boolean overlaps(EffectivePeriod other) {
        boolean startsBeforeOtherEnds = other.to == null || !from.isAfter(other.to);
        boolean otherStartsBeforeThisEnds = to == null || !other.from.isAfter(to);
        return startsBeforeOtherEnds && otherStartsBeforeThisEnds;
    }

    public boolean isOrdered() {
        return to == null || !to.isBefore(from);
    }
}
