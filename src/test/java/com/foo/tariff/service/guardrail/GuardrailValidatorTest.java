package com.foo.tariff.service.guardrail;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.foo.tariff.config.TariffEngineProperties;
import com.foo.tariff.exception.RequestValidationException;
import com.foo.tariff.model.CalculationRequest;
import com.foo.tariff.model.OperationalFlag;
import com.foo.tariff.repository.TariffRepository;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

class GuardrailValidatorTest {

    private TariffRepository repository;
    private GuardrailValidator guardrail;

    @BeforeEach
    void setUp() {
        Validator validator = Validation.buildDefaultValidatorFactory().getValidator();
        repository = mock(TariffRepository.class);
        when(repository.isKnownPort("DUR")).thenReturn(true);
        guardrail = new GuardrailValidator(validator, repository, new TariffEngineProperties());
    }

    @Test
    void validRequest_producesNormalizedProfile() {
        RawCalculationRequest raw = validRaw();
        raw.setPort(" dur ");
        raw.setFlags(new LinkedHashMap<>(Map.of("is_coaster", true, "vessel_type", "Bulk_Carrier")));
        raw.setDueTypes(List.of("light_dues"));

        CalculationRequest request = guardrail.validate(raw);

        assertThat(request.profile().port()).isEqualTo("DUR");
        assertThat(request.profile().grossTonnage()).isEqualByComparingTo("51300");
        assertThat(request.profile().arrival()).isEqualTo(LocalDateTime.of(2024, 1, 10, 0, 0));
        assertThat(request.profile().flagValue(OperationalFlag.COASTER)).isEqualTo(true);
        assertThat(request.profile().flagValue(OperationalFlag.VESSEL_TYPE)).isEqualTo("bulk_carrier");
        assertThat(request.dueTypes()).containsExactly("light_dues");
        assertThat(request.scheduleVersion()).isNull();
    }

    @Test
    void missingPort_reportedFirst() {
        RawCalculationRequest raw = new RawCalculationRequest();

        assertRejected(() -> guardrail.validate(raw), "port", "required");
    }

    @Test
    void missingDepartureDate_namesSnakeCaseField() {
        RawCalculationRequest raw = validRaw();
        raw.setDepartureDate(null);

        assertRejected(() -> guardrail.validate(raw), "departure_date", "required");
    }

    @Test
    void negativeGrossTonnage_rejectedAsNotPositive() {
        RawCalculationRequest raw = validRaw();
        raw.setGrossTonnage("-5");

        assertRejected(() -> guardrail.validate(raw), "gross_tonnage", "positive");
        verify(repository, never()).isKnownPort(anyString());
    }

    @Test
    void nonNumericGrossTonnage_rejectedAsNotFinite() {
        RawCalculationRequest raw = validRaw();
        raw.setGrossTonnage("Infinity");

        assertRejected(() -> guardrail.validate(raw), "gross_tonnage", "finite_number");
    }

    @Test
    void hugeExponentGrossTonnage_rejectedBeforeExpansion() {
        RawCalculationRequest raw = validRaw();
        raw.setGrossTonnage("1E+1000000000");

        assertRejected(() -> guardrail.validate(raw), "gross_tonnage", "finite_number");
        verify(repository, never()).isKnownPort(anyString());
    }

    @Test
    void tinyExponentGrossTonnage_rejected() {
        RawCalculationRequest raw = validRaw();
        raw.setGrossTonnage("1E-1000000000");

        assertRejected(() -> guardrail.validate(raw), "gross_tonnage", "finite_number");
    }

    @Test
    void grossTonnageWithTooManyDecimals_rejected() {
        RawCalculationRequest raw = validRaw();
        raw.setGrossTonnage("51300.00001");

        assertRejected(() -> guardrail.validate(raw), "gross_tonnage", "max_scale");
    }

    @Test
    void trailingZeroDecimals_accepted() {
        RawCalculationRequest raw = validRaw();
        raw.setGrossTonnage("51300.500000");

        assertThat(guardrail.validate(raw).profile().grossTonnage()).isEqualByComparingTo("51300.5");
    }

    @Test
    void grossTonnageAboveCeiling_rejected() {
        RawCalculationRequest raw = validRaw();
        raw.setGrossTonnage("10000000.5");

        assertRejected(() -> guardrail.validate(raw), "gross_tonnage", "max_value");
    }

    @Test
    void grossTonnageAtCeiling_accepted() {
        RawCalculationRequest raw = validRaw();
        raw.setGrossTonnage("10000000");

        assertThat(guardrail.validate(raw).profile().grossTonnage()).isEqualByComparingTo("10000000");
    }

    @Test
    void arrivalEqualToDeparture_rejected() {
        RawCalculationRequest raw = validRaw();
        raw.setDepartureDate(raw.getArrivalDate());

        assertRejected(
                () -> guardrail.validate(raw), "arrival_date/departure_date", "arrival_before_departure");
    }

    @Test
    void unparsableDate_rejectedAsIsoDate() {
        RawCalculationRequest raw = validRaw();
        raw.setArrivalDate("10/01/2024");

        assertRejected(() -> guardrail.validate(raw), "arrival_date", "iso_date");
    }

    @Test
    void dateTimeValues_keepTimeOfDay() {
        RawCalculationRequest raw = validRaw();
        raw.setArrivalDate("2024-01-10T06:00");
        raw.setDepartureDate("2024-01-10T18:00");

        CalculationRequest request = guardrail.validate(raw);

        assertThat(request.profile().departure()).isEqualTo(LocalDateTime.of(2024, 1, 10, 18, 0));
    }

    @Test
    void unknownFlag_rejectedNotDropped() {
        RawCalculationRequest raw = validRaw();
        raw.setFlags(new LinkedHashMap<>(Map.of("is_submarine", true)));

        assertRejected(() -> guardrail.validate(raw), "flags.is_submarine", "known_flag");
    }

    @Test
    void flagWithWrongType_rejected() {
        RawCalculationRequest raw = validRaw();
        raw.setFlags(new LinkedHashMap<>(Map.of("num_operations", "two")));

        assertRejected(() -> guardrail.validate(raw), "flags.num_operations", "flag_type");
    }

    @Test
    void blankDueType_rejected() {
        RawCalculationRequest raw = validRaw();
        raw.setDueTypes(List.of("light_dues", " "));

        assertRejected(() -> guardrail.validate(raw), "due_types", "not_blank");
    }

    @Test
    void unknownPort_rejectedAfterShapeChecks() {
        RawCalculationRequest raw = validRaw();
        raw.setPort("XYZ");

        assertRejected(() -> guardrail.validate(raw), "port", "known_port");
    }

    @Test
    void nullRequest_rejected() {
        assertRejected(() -> guardrail.validate(null), "request", "required");
    }

    @Test
    void grossTonnage_keepsDecimalPrecision() {
        RawCalculationRequest raw = validRaw();
        raw.setGrossTonnage("51300.5");

        assertThat(guardrail.validate(raw).profile().grossTonnage())
                .isEqualTo(new BigDecimal("51300.5"));
    }

    private static void assertRejected(ThrowingCallable call, String field, String constraint) {
        assertThatThrownBy(call)
                .isInstanceOf(RequestValidationException.class)
                .satisfies(
                        e -> {
                            RequestValidationException rve = (RequestValidationException) e;
                            assertThat(rve.getField()).isEqualTo(field);
                            assertThat(rve.getConstraint()).isEqualTo(constraint);
                        });
    }

    private static RawCalculationRequest validRaw() {
        RawCalculationRequest raw = new RawCalculationRequest();
        raw.setPort("DUR");
        raw.setVesselName("SUDESTADA");
        raw.setGrossTonnage("51300");
        raw.setArrivalDate("2024-01-10");
        raw.setDepartureDate("2024-01-13");
        return raw;
    }
}
