package com.foo.tariff.service.ingest;

import com.foo.tariff.annotation.SheetColumn;
import com.foo.tariff.validation.CellError;
import com.foo.tariff.validation.RowError;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.lang.reflect.Field;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/** 요율표 행에 Bean Validation 제약을 적용하고 위반을 시트·행 단위 {@link RowError}로 바꾼다. */
@Service
@RequiredArgsConstructor
public class ScheduleRowValidationService {

    private final Validator validator;

    public <T> List<RowError> validate(SheetRows<T> sheetRows, Class<T> rowClass) {
        List<RowError> errors = new ArrayList<>();

        for (int i = 0; i < sheetRows.size(); i++) {
            Set<ConstraintViolation<T>> violations = validator.validate(sheetRows.row(i));
            if (violations.isEmpty()) {
                continue;
            }

            List<CellError> cellErrors =
                    violations.stream()
                            .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                            .map(v -> toCellError(v, rowClass))
                            .toList();
            errors.add(
                    RowError.builder()
                            .sheet(sheetRows.sheet())
                            .rowNumber(sheetRows.rowNumber(i))
                            .cellErrors(new ArrayList<>(cellErrors))
                            .build());
        }
        return errors;
    }

    private <T> CellError toCellError(ConstraintViolation<T> violation, Class<T> rowClass) {
        String fieldName = violation.getPropertyPath().toString();
        SheetColumn column = findSheetColumn(fieldName, rowClass);

        return CellError.builder()
                .fieldName(fieldName)
                .headerName(column != null ? column.header() : fieldName)
                .rejectedValue(violation.getInvalidValue())
                .message(violation.getMessage())
                .build();
    }

    private SheetColumn findSheetColumn(String fieldName, Class<?> rowClass) {
        try {
            Field field = rowClass.getDeclaredField(fieldName);
            return field.getAnnotation(SheetColumn.class);
        } catch (NoSuchFieldException e) {
            return null;
        }
    }
}
