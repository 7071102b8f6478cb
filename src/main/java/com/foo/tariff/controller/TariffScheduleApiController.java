package com.foo.tariff.controller;

import com.foo.tariff.repository.TariffRepository;
import com.foo.tariff.service.ingest.ScheduleSummary;
import com.foo.tariff.service.ingest.TariffScheduleImportService;
import com.foo.tariff.service.ingest.dto.TariffSchedulePayload;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/tariff/schedules")
@RequiredArgsConstructor
public class TariffScheduleApiController {

    private final TariffScheduleImportService importService;
    private final TariffRepository repository;

    @PostMapping
    public ResponseEntity<Map<String, Object>> publish(@RequestBody TariffSchedulePayload payload) {
        return published(importService.importPayload(payload));
    }

    /**
     * @param dueTypeOrder 쉼표로 구분한 due type 순서. 비어 있으면 시트 등장 순서
     */
    @PostMapping("/upload")
    public ResponseEntity<Map<String, Object>> upload(
            @RequestPart("file") MultipartFile file,
            @RequestParam(value = "label", required = false) String label,
            @RequestParam(value = "currency", required = false) String currency,
            @RequestParam(value = "dueTypeOrder", required = false) List<String> dueTypeOrder)
            throws IOException {
        return published(importService.importWorkbook(file, label, currency, dueTypeOrder));
    }

    @GetMapping
    public List<ScheduleSummary> list() {
        return repository.listSnapshots().stream().map(ScheduleSummary::of).toList();
    }

    private ResponseEntity<Map<String, Object>> published(ScheduleSummary summary) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("version", summary.version());
        body.put("schedule", summary);
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }
}
