package com.foo.tariff.service.guardrail;

import com.foo.tariff.config.TariffEngineProperties;
import com.foo.tariff.exception.RequestValidationException;
import com.foo.tariff.model.CalculationRequest;
import com.foo.tariff.model.OperationalFlag;
import com.foo.tariff.model.VesselProfile;
import com.foo.tariff.repository.TariffRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 계산 요청 가드레일. 아래 순서대로 검사하고 처음 실패한 항목에서 멈춘다.
 *
 * <ol>
 *   <li>필수 필드
 *   <li>gross_tonnage: 지수 표기 없는 양의 소수, 소수 자릿수와 상한 이내
 *   <li>입·출항 일시 형식(ISO 날짜 또는 ISO 일시)
 *   <li>입항이 출항보다 앞서는지
 *   <li>운항 플래그: 허용 목록과 값 타입
 *   <li>due type 필터
 *   <li>항구 코드에 해당하는 요율표 존재 여부
 * </ol>
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GuardrailValidator {

    private static final List<String> REQUIRED_FIELD_ORDER =
            List.of("port", "grossTonnage", "arrivalDate", "departureDate");

    private static final Pattern PLAIN_DECIMAL = Pattern.compile("[+-]?\\d{1,18}(\\.\\d{1,18})?");

    private final Validator validator;
    private final TariffRepository repository;
    private final TariffEngineProperties properties;

    public CalculationRequest validate(RawCalculationRequest raw) {
        if (raw == null) {
            throw new RequestValidationException("request", "required", "요청 본문이 없습니다.");
        }

        checkRequiredFields(raw);

        BigDecimal grossTonnage = parseGrossTonnage(raw.getGrossTonnage());
        LocalDateTime arrival = parseDateTime("arrival_date", raw.getArrivalDate());
        LocalDateTime departure = parseDateTime("departure_date", raw.getDepartureDate());
        if (!arrival.isBefore(departure)) {
            throw new RequestValidationException(
                    "arrival_date/departure_date",
                    "arrival_before_departure",
                    "입항 일시(arrival_date)는 출항 일시(departure_date)보다 앞서야 합니다.");
        }

        Map<OperationalFlag, Object> flags = parseFlags(raw.getFlags());
        Set<String> dueTypes = parseDueTypes(raw.getDueTypes());

        String port = raw.getPort().trim().toUpperCase();
        if (!repository.isKnownPort(port)) {
            throw new RequestValidationException(
                    "port", "known_port", "요율표가 등록되지 않은 항구입니다: " + port);
        }

        VesselProfile profile =
                VesselProfile.builder()
                        .port(port)
                        .vesselName(raw.getVesselName() == null ? null : raw.getVesselName().trim())
                        .grossTonnage(grossTonnage)
                        .arrival(arrival)
                        .departure(departure)
                        .flags(flags)
                        .build();

        return CalculationRequest.builder()
                .profile(profile)
                .includeExplanation(raw.isIncludeExplanation())
                .scheduleVersion(raw.getScheduleVersion())
                .dueTypes(dueTypes)
                .build();
    }

    private void checkRequiredFields(RawCalculationRequest raw) {
        Set<ConstraintViolation<RawCalculationRequest>> violations = validator.validate(raw);
        violations.stream()
                .map(v -> v.getPropertyPath().toString())
                .min(Comparator.comparingInt(REQUIRED_FIELD_ORDER::indexOf))
                .ifPresent(
                        field -> {
                            String name = toSnakeCase(field);
                            throw new RequestValidationException(name, "required", name + "은(는) 필수입니다.");
                        });
    }

    private BigDecimal parseGrossTonnage(String value) {
        String trimmed = value.trim();
        if (!PLAIN_DECIMAL.matcher(trimmed).matches()) {
            throw new RequestValidationException(
                    "gross_tonnage", "finite_number",
                    "gross_tonnage는 지수 표기 없는 유한한 숫자여야 합니다: " + abbreviate(value));
        }
        BigDecimal grossTonnage = new BigDecimal(trimmed);
        if (grossTonnage.signum() <= 0) {
            throw new RequestValidationException(
                    "gross_tonnage", "positive", "gross_tonnage는 0보다 커야 합니다: " + value);
        }
        int maxScale = properties.getGrossTonnageMaxScale();
        if (grossTonnage.stripTrailingZeros().scale() > maxScale) {
            throw new RequestValidationException(
                    "gross_tonnage", "max_scale",
                    "gross_tonnage의 소수 자릿수는 " + maxScale + "자리 이하여야 합니다: " + value);
        }
        BigDecimal maxGrossTonnage = properties.getMaxGrossTonnage();
        if (grossTonnage.compareTo(maxGrossTonnage) > 0) {
            throw new RequestValidationException(
                    "gross_tonnage", "max_value",
                    "gross_tonnage는 " + maxGrossTonnage.toPlainString() + " 이하여야 합니다: " + value);
        }
        return grossTonnage;
    }

    private LocalDateTime parseDateTime(String field, String value) {
        String trimmed = value.trim();
        try {
            if (trimmed.length() == 10) {
                return LocalDate.parse(trimmed).atStartOfDay();
            }
            return LocalDateTime.parse(trimmed);
        } catch (DateTimeParseException e) {
            throw new RequestValidationException(
                    field,
                    "iso_date",
                    field + " 형식이 올바르지 않습니다 (예: 2024-01-10 또는 2024-01-10T08:30): " + value);
        }
    }

    private Map<OperationalFlag, Object> parseFlags(Map<String, Object> rawFlags) {
        Map<OperationalFlag, Object> flags = new EnumMap<>(OperationalFlag.class);
        if (rawFlags == null) {
            return flags;
        }
        for (Map.Entry<String, Object> entry : rawFlags.entrySet()) {
            String field = "flags." + entry.getKey();
            OperationalFlag flag =
                    OperationalFlag.fromCode(entry.getKey())
                            .orElseThrow(
                                    () ->
                                            new RequestValidationException(
                                                    field, "known_flag", "알 수 없는 운항 플래그입니다: " + entry.getKey()));
            Object value = entry.getValue();
            if (!flag.accepts(value)) {
                throw new RequestValidationException(
                        field,
                        "flag_type",
                        "%s 값이 올바르지 않습니다. 기대 타입: %s%s"
                                .formatted(
                                        field,
                                        flag.getType(),
                                        flag.getAllowedValues().isEmpty() ? "" : " " + flag.getAllowedValues()));
            }
            flags.put(flag, value instanceof String s ? s.trim().toLowerCase() : value);
        }
        return flags;
    }

    private Set<String> parseDueTypes(List<String> rawDueTypes) {
        Set<String> dueTypes = new LinkedHashSet<>();
        if (rawDueTypes == null) {
            return dueTypes;
        }
        for (String dueType : rawDueTypes) {
            if (dueType == null || dueType.isBlank()) {
                throw new RequestValidationException(
                        "due_types", "not_blank", "due_types에 빈 값이 포함되어 있습니다.");
            }
            dueTypes.add(dueType.trim());
        }
        return dueTypes;
    }

    private static String abbreviate(String value) {
        return value.length() <= 32 ? value : value.substring(0, 32) + "...";
    }

    private static String toSnakeCase(String field) {
        return field.replaceAll("([a-z])([A-Z])", "$1_$2").toLowerCase();
    }
}
