package com.foo.tariff.service.explanation;

import com.foo.tariff.config.TariffEngineProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/** {@code tariff.engine.clause-references} 설정값으로 조항 참조를 제공한다. */
@Component
@RequiredArgsConstructor
public class ConfiguredClauseReferenceSource implements ClauseReferenceSource {

    private final TariffEngineProperties properties;

    @Override
    public Map<String, String> lookup(Collection<String> ruleIds) {
        Map<String, String> configured = properties.getClauseReferences();
        Map<String, String> found = new LinkedHashMap<>();
        for (String ruleId : ruleIds) {
            String reference = configured.get(ruleId);
            if (reference != null) {
                found.put(ruleId, reference);
            }
        }
        return found;
    }
}
