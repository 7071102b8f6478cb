package com.foo.tariff.validation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RowError {
    private String sheet;
    private int rowNumber;
    @Builder.Default private List<CellError> cellErrors = new ArrayList<>();

    public String getFormattedMessage() {
        return cellErrors.stream()
                .map(e -> "[" + (e.columnLetter() != null ? e.columnLetter() : e.fieldName()) + "] "
                        + e.message())
                .collect(Collectors.joining("; "));
    }
}
