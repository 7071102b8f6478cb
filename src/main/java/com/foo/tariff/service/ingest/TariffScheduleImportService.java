package com.foo.tariff.service.ingest;

import com.foo.tariff.config.ScheduleWorkbookConfig;
import com.foo.tariff.config.TariffEngineProperties;
import com.foo.tariff.exception.InvalidScheduleException;
import com.foo.tariff.model.TariffSchedule;
import com.foo.tariff.repository.TariffRepository;
import com.foo.tariff.service.ingest.ScheduleWorkbookParser.ParsedWorkbook;
import com.foo.tariff.service.ingest.dto.ExemptionRow;
import com.foo.tariff.service.ingest.dto.FeeRuleRow;
import com.foo.tariff.service.ingest.dto.RateTierRow;
import com.foo.tariff.service.ingest.dto.SurchargeRow;
import com.foo.tariff.service.ingest.dto.TariffSchedulePayload;
import com.foo.tariff.validation.ScheduleValidationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * 요율표 게시 흐름: (워크북이면 저장 → 파싱) → 행 검증 → 조립 → 저장소 게시.
 *
 * <p>어느 단계든 실패하면 아무것도 게시되지 않는다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TariffScheduleImportService {

    private final ScheduleWorkbookFileService fileService;
    private final ScheduleWorkbookParser parser;
    private final ScheduleRowValidationService rowValidationService;
    private final TariffScheduleAssembler assembler;
    private final TariffRepository repository;
    private final ScheduleWorkbookConfig workbookConfig;
    private final TariffEngineProperties properties;

    public ScheduleSummary importPayload(TariffSchedulePayload payload) {
        SheetRows<RateTierRow> tiers =
                SheetRows.ofPayload(workbookConfig.getRateTierSheet(), payload.getRateTiers());
        SheetRows<FeeRuleRow> fees =
                SheetRows.ofPayload(workbookConfig.getFeeRuleSheet(), payload.getFeeRules());
        SheetRows<ExemptionRow> exemptions =
                SheetRows.ofPayload(workbookConfig.getExemptionSheet(), payload.getExemptions());
        SheetRows<SurchargeRow> surcharges =
                SheetRows.ofPayload(workbookConfig.getSurchargeSheet(), payload.getSurcharges());

        // label, currency 같은 머리 항목은 "schedule" 1행으로 보고한다
        ScheduleValidationResult header =
                ScheduleValidationResult.failure(
                        0,
                        rowValidationService.validate(
                                SheetRows.ofPayload("schedule", List.of(payload)), TariffSchedulePayload.class));
        ScheduleValidationResult validation = validateRows(tiers, fees, exemptions, surcharges, header);
        return publish(
                payload.getLabel(),
                currencyOrDefault(payload.getCurrency()),
                payload.getDueTypeOrder(),
                tiers,
                fees,
                exemptions,
                surcharges,
                validation);
    }

    /**
     * @param label 비어 있으면 업로드 파일명
     * @param currency 비어 있으면 기본 통화
     * @param dueTypeOrder 비어 있으면 시트 등장 순서
     */
    public ScheduleSummary importWorkbook(
            MultipartFile file, String label, String currency, List<String> dueTypeOrder)
            throws IOException {
        Path stored = fileService.storeAndValidateXlsx(file);
        try {
            ParsedWorkbook parsed = parser.parse(stored);
            ScheduleValidationResult validation =
                    validateRows(
                            parsed.rateTiers(),
                            parsed.feeRules(),
                            parsed.exemptions(),
                            parsed.surcharges(),
                            ScheduleValidationResult.failure(0, parsed.parseErrors()));
            String effectiveLabel =
                    label == null || label.isBlank() ? file.getOriginalFilename() : label;
            return publish(
                    effectiveLabel,
                    currencyOrDefault(currency),
                    dueTypeOrder,
                    parsed.rateTiers(),
                    parsed.feeRules(),
                    parsed.exemptions(),
                    parsed.surcharges(),
                    validation);
        } finally {
            Files.deleteIfExists(stored);
        }
    }

    private ScheduleValidationResult validateRows(
            SheetRows<RateTierRow> tiers,
            SheetRows<FeeRuleRow> fees,
            SheetRows<ExemptionRow> exemptions,
            SheetRows<SurchargeRow> surcharges,
            ScheduleValidationResult result) {
        result.merge(rowValidationService.validate(tiers, RateTierRow.class));
        result.merge(rowValidationService.validate(fees, FeeRuleRow.class));
        result.merge(rowValidationService.validate(exemptions, ExemptionRow.class));
        result.merge(rowValidationService.validate(surcharges, SurchargeRow.class));
        result.setTotalRows(tiers.size() + fees.size() + exemptions.size() + surcharges.size());
        return result;
    }

    private ScheduleSummary publish(
            String label,
            String currency,
            List<String> dueTypeOrder,
            SheetRows<RateTierRow> tiers,
            SheetRows<FeeRuleRow> fees,
            SheetRows<ExemptionRow> exemptions,
            SheetRows<SurchargeRow> surcharges,
            ScheduleValidationResult validation) {
        if (!validation.isValid()) {
            log.warn(
                    "요율표 행 검증 실패: label={}, {} row(s), {} error(s)",
                    label,
                    validation.getErrorRowCount(),
                    validation.getTotalErrorCount());
            throw InvalidScheduleException.rowErrors(validation.getRowErrors());
        }

        TariffSchedule draft = assembler.assemble(
                label, currency, dueTypeOrder, tiers, fees, exemptions, surcharges);
        long version = repository.publish(draft);
        return ScheduleSummary.of(repository.getSnapshot(draft.ports().iterator().next(), version));
    }

    private String currencyOrDefault(String currency) {
        return currency == null || currency.isBlank() ? properties.getDefaultCurrency() : currency;
    }
}
