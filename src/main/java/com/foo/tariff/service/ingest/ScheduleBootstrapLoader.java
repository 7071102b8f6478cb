package com.foo.tariff.service.ingest;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.foo.tariff.config.TariffEngineProperties;
import com.foo.tariff.service.ingest.dto.TariffSchedulePayload;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * {@code tariff.engine.bootstrap-schedule}에 지정된 요율표 payload를 기동 시 게시한다.
 *
 * <p>위치가 비어 있으면 아무것도 하지 않는다. 지정된 파일을 읽지 못하거나 게시가 거부되면 기동을 실패시킨다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduleBootstrapLoader implements ApplicationRunner {

    private final TariffEngineProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final TariffScheduleImportService importService;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        String location = properties.getBootstrapSchedule();
        if (location == null || location.isBlank()) {
            log.debug("No bootstrap schedule configured");
            return;
        }

        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new IllegalStateException("Bootstrap schedule not found: " + location);
        }

        TariffSchedulePayload payload;
        try (InputStream in = resource.getInputStream()) {
            payload = objectMapper.readValue(in, TariffSchedulePayload.class);
        }
        ScheduleSummary summary = importService.importPayload(payload);
        log.info(
                "Bootstrap schedule '{}' published as v{} for ports {}",
                summary.label(),
                summary.version(),
                summary.ports());
    }
}
