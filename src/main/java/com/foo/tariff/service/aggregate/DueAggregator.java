package com.foo.tariff.service.aggregate;

import com.foo.tariff.model.DueLineItem;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 통화별 합계. 항목마다 소수 둘째 자리까지 반올림(HALF_UP)한 뒤 더하고, 합계도 같은 방식으로 반올림한다.
 * 통화 순서는 항목에 처음 등장한 순서.
 */
@Component
public class DueAggregator {

    public static final int SCALE = 2;

    public Map<String, BigDecimal> aggregate(List<DueLineItem> items) {
        Map<String, BigDecimal> totals = new LinkedHashMap<>();
        for (DueLineItem item : items) {
            totals.merge(item.currency(), round(item.baseAmount()), BigDecimal::add);
        }
        totals.replaceAll((currency, total) -> round(total));
        return totals;
    }

    public static BigDecimal round(BigDecimal amount) {
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }
}
