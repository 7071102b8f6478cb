package com.foo.tariff.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleValidationResult {
    private boolean valid;
    private int totalRows;
    private int errorRowCount;
    private int totalErrorCount;
    @Builder.Default
    private List<RowError> rowErrors = new ArrayList<>();

    public static ScheduleValidationResult success(int totalRows) {
        return ScheduleValidationResult.builder()
                .valid(true)
                .totalRows(totalRows)
                .build();
    }

    public static ScheduleValidationResult failure(int totalRows, List<RowError> rowErrors) {
        ScheduleValidationResult result = success(totalRows);
        result.merge(rowErrors);
        return result;
    }

    /**
     * 같은 시트·행의 오류는 하나의 RowError로 합친다.
     */
    public void merge(List<RowError> additionalErrors) {
        for (RowError srcError : additionalErrors) {
            RowError existing = rowErrors.stream()
                    .filter(r -> r.getRowNumber() == srcError.getRowNumber()
                            && Objects.equals(r.getSheet(), srcError.getSheet()))
                    .findFirst()
                    .orElse(null);

            if (existing != null) {
                existing.getCellErrors().addAll(srcError.getCellErrors());
            } else {
                rowErrors.add(srcError);
            }
        }

        if (!rowErrors.isEmpty()) {
            this.valid = false;
            this.errorRowCount = rowErrors.size();
            this.totalErrorCount = rowErrors.stream()
                    .mapToInt(r -> r.getCellErrors().size())
                    .sum();
        }
    }
}
