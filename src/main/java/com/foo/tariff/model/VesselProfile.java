package com.foo.tariff.model;

import lombok.Builder;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/** 검증을 통과한 선박 정보. 가드레일 밖에서는 생성하지 않는다. */
@Builder
public record VesselProfile(
        String port,
        String vesselName,
        BigDecimal grossTonnage,
        LocalDateTime arrival,
        LocalDateTime departure,
        Map<OperationalFlag, Object> flags) {

    public VesselProfile {
        EnumMap<OperationalFlag, Object> copy = new EnumMap<>(OperationalFlag.class);
        if (flags != null) {
            copy.putAll(flags);
        }
        flags = Collections.unmodifiableMap(copy);
    }

    public Object flagValue(OperationalFlag flag) {
        return flags.get(flag);
    }

    public boolean hasFlag(OperationalFlag flag) {
        return flags.containsKey(flag);
    }
}
