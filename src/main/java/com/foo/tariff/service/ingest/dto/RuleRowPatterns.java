package com.foo.tariff.service.ingest.dto;

/** 행 DTO의 {@code @Pattern} 정규식. */
final class RuleRowPatterns {

    static final String UNIT = "(?i)\\s*(flat|per_gt|per_gt_per_day|per_100gt|per_100gt_per_day|per_100gt_above_min)\\s*";
    static final String COMPARISON = "(?i)\\s*(eq|ne|gt|ge|lt|le)\\s*";
    static final String CURRENCY = "[A-Za-z]{3}";

    private RuleRowPatterns() {}
}
