package com.foo.tariff.model;

import java.util.List;

/** 선택된 규칙과, 해당 due type에 처음으로 충족된 감면 조건(없으면 null), 충족된 할증 목록. */
public record ResolvedItem(TariffRule rule, ExemptionCondition exemption, List<SurchargeRule> surcharges) {

    public ResolvedItem {
        surcharges = surcharges == null ? List.of() : List.copyOf(surcharges);
    }

    public ResolvedItem(TariffRule rule, ExemptionCondition exemption) {
        this(rule, exemption, List.of());
    }

    public boolean isExempt() {
        return exemption != null;
    }
}
