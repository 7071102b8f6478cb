package com.foo.tariff.service.ingest;

import java.util.List;
import java.util.stream.IntStream;

/**
 * 한 시트(또는 payload 배열)의 행과 각 행의 원본 행 번호.
 *
 * <p>워크북은 엑셀 행 번호(1-based), JSON payload는 배열 위치(1-based)를 쓴다.
 */
public record SheetRows<T>(String sheet, List<T> rows, List<Integer> rowNumbers) {

    public SheetRows {
        rows = rows == null ? List.of() : List.copyOf(rows);
        rowNumbers = rowNumbers == null ? List.of() : List.copyOf(rowNumbers);
        if (rows.size() != rowNumbers.size()) {
            throw new IllegalArgumentException("rows and rowNumbers must have the same size");
        }
    }

    public static <T> SheetRows<T> ofPayload(String sheet, List<T> rows) {
        List<T> safeRows = rows == null ? List.of() : rows.stream().filter(r -> r != null).toList();
        return new SheetRows<>(
                sheet, safeRows, IntStream.rangeClosed(1, safeRows.size()).boxed().toList());
    }

    public static <T> SheetRows<T> empty(String sheet) {
        return new SheetRows<>(sheet, List.of(), List.of());
    }

    public int size() {
        return rows.size();
    }

    public T row(int i) {
        return rows.get(i);
    }

    public int rowNumber(int i) {
        return rowNumbers.get(i);
    }
}
