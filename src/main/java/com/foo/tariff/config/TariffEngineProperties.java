package com.foo.tariff.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Component
@ConfigurationProperties(prefix = "tariff.engine")
public class TariffEngineProperties {

    /** 최신 버전 외에 버전 고정(pin) 조회를 위해 유지하는 이전 스냅샷 수. */
    private int retainedVersions = 5;

    /** 조항 참조 조회 상한(ms). 초과 시 설명 참조 없이 결과를 반환한다. */
    private long explanationTimeoutMs = 500;

    private int explanationThreads = 2;

    /** 요율표 payload나 규칙 행에 통화가 없을 때 쓰는 ISO 4217 코드. */
    private String defaultCurrency = "ZAR";

    private int maxWorkbookSizeMb = 10;
    private String tempDirectory = System.getProperty("java.io.tmpdir") + "/tariff-schedules";

    /** 기동 시 게시할 요율표 payload 위치(classpath: 또는 file:). 비어 있으면 건너뛴다. */
    private String bootstrapSchedule;

    /** 계산 요청에서 허용하는 gross_tonnage 상한. */
    private BigDecimal maxGrossTonnage = new BigDecimal("10000000");

    private int grossTonnageMaxScale = 4;

    /** rule_id → 외부 조항 참조 ID. */
    private Map<String, String> clauseReferences = new LinkedHashMap<>();

    /** 계산 결과 점검 기준. 벗어나도 계산은 실패하지 않고 warnings에 남는다. */
    private ResultCheck resultCheck = new ResultCheck();

    @PostConstruct
    public void init() throws IOException {
        Path tempDir = Path.of(tempDirectory);
        if (!Files.exists(tempDir)) {
            Files.createDirectories(tempDir);
        }
    }

    public Path getTempDirectoryPath() {
        return Path.of(tempDirectory);
    }

    @Data
    public static class ResultCheck {

        /** 이 톤수를 넘는 요청은 입력 확인 경고를 남긴다. */
        private BigDecimal largeGrossTonnage = new BigDecimal("600000");

        /** 통화별 합계 상한. */
        private BigDecimal maxTotal = new BigDecimal("15000000");

        /** due type → 정상 금액 범위. */
        private Map<String, AmountRange> dueRanges = new LinkedHashMap<>();

        /** due type → 최저 부과액. */
        private Map<String, BigDecimal> dueMinimums = new LinkedHashMap<>();

        /** 항구 코드 → 반드시 계산되어야 하는 due type. */
        private Map<String, List<String>> compulsoryDueTypes = new LinkedHashMap<>();
    }

    @Data
    public static class AmountRange {
        private BigDecimal min;
        private BigDecimal max;
    }
}
