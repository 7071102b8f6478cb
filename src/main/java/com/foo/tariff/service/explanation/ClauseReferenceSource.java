package com.foo.tariff.service.explanation;

import java.util.Collection;
import java.util.Map;

/**
 * rule_id를 외부 정책 조항 참조로 바꿔 주는 외부 협력자. 구현체는 I/O를 할 수 있으며 실패할 수 있다.
 */
public interface ClauseReferenceSource {

    /** 알려진 rule_id에 대해서만 참조를 돌려준다. 모르는 rule_id는 결과에서 빠진다. */
    Map<String, String> lookup(Collection<String> ruleIds);
}
