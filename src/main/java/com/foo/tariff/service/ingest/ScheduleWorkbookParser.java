package com.foo.tariff.service.ingest;

import com.foo.tariff.annotation.SheetColumn;
import com.foo.tariff.config.ScheduleWorkbookConfig;
import com.foo.tariff.service.ingest.dto.ExemptionRow;
import com.foo.tariff.service.ingest.dto.FeeRuleRow;
import com.foo.tariff.service.ingest.dto.RateTierRow;
import com.foo.tariff.service.ingest.dto.SurchargeRow;
import com.foo.tariff.util.SecureWorkbookUtils;
import com.foo.tariff.validation.CellError;
import com.foo.tariff.validation.RowError;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.util.CellReference;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.lang.reflect.Field;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 요율표 워크북(RateTiers, FeeRules, Exemptions, Surcharges 시트)을 행 DTO로 읽는다.
 *
 * <p>컬럼은 {@link SheetColumn#header()}로 헤더 행에서 찾는다. 셀 타입 변환 실패는 예외가 아니라
 * {@link RowError}로 모아 행 검증 결과와 함께 보고한다. 없는 시트는 빈 시트로 취급한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleWorkbookParser {

    private static final ThreadLocal<DataFormatter> DATA_FORMATTER =
            ThreadLocal.withInitial(DataFormatter::new);

    private final ScheduleWorkbookConfig config;

    record ColumnMapping(Field field, SheetColumn annotation, int columnIndex, String columnLetter) {}

    public record ParsedWorkbook(
            SheetRows<RateTierRow> rateTiers,
            SheetRows<FeeRuleRow> feeRules,
            SheetRows<ExemptionRow> exemptions,
            SheetRows<SurchargeRow> surcharges,
            List<RowError> parseErrors) {}

    /**
     * @throws ColumnResolutionException 필수 헤더가 없을 때
     * @throws IllegalArgumentException 시트의 데이터 행이 상한을 넘을 때
     */
    public ParsedWorkbook parse(Path xlsxFile) throws IOException {
        List<RowError> parseErrors = new ArrayList<>();

        try (Workbook workbook = SecureWorkbookUtils.openWorkbook(xlsxFile)) {
            SheetRows<RateTierRow> tiers =
                    parseSheet(workbook, config.getRateTierSheet(), RateTierRow.class, parseErrors);
            SheetRows<FeeRuleRow> fees =
                    parseSheet(workbook, config.getFeeRuleSheet(), FeeRuleRow.class, parseErrors);
            SheetRows<ExemptionRow> exemptions =
                    parseSheet(workbook, config.getExemptionSheet(), ExemptionRow.class, parseErrors);
            SheetRows<SurchargeRow> surcharges =
                    parseSheet(workbook, config.getSurchargeSheet(), SurchargeRow.class, parseErrors);

            log.debug("Parsed workbook {}: {} tier(s), {} fee(s), {} exemption(s), {} surcharge(s), {} parse error row(s)",
                    xlsxFile.getFileName(), tiers.size(), fees.size(), exemptions.size(), surcharges.size(),
                    parseErrors.size());
            return new ParsedWorkbook(tiers, fees, exemptions, surcharges, parseErrors);
        }
    }

    private <T> SheetRows<T> parseSheet(Workbook workbook, String sheetName, Class<T> rowClass,
                                        List<RowError> parseErrors) {
        Sheet sheet = workbook.getSheet(sheetName);
        if (sheet == null) {
            log.debug("Sheet '{}' not present, treating as empty", sheetName);
            return SheetRows.empty(sheetName);
        }

        Row headerRow = sheet.getRow(config.getHeaderRow() - 1);
        if (headerRow == null) {
            throw new ColumnResolutionException(sheetName, requiredHeaders(rowClass));
        }

        List<ColumnMapping> mappings = resolveColumnMappings(sheetName, rowClass, headerRow);
        List<T> rows = new ArrayList<>();
        List<Integer> rowNumbers = new ArrayList<>();

        for (int i = config.getDataStartRow() - 1; i <= sheet.getLastRowNum(); i++) {
            Row row = sheet.getRow(i);
            if (row == null) {
                continue;
            }
            if (isFooterRow(row)) {
                log.debug("Footer marker found in '{}' at row {}, stopping", sheetName, i + 1);
                break;
            }
            if (isBlankRow(row)) {
                continue;
            }
            if (rows.size() >= config.getMaxRowsPerSheet()) {
                throw new IllegalArgumentException(
                        "'%s' 시트의 데이터 행이 최대 %d행을 초과합니다"
                                .formatted(sheetName, config.getMaxRowsPerSheet()));
            }

            int excelRowNumber = i + 1;
            List<CellError> cellErrors = new ArrayList<>();
            T dto = instantiate(rowClass);

            for (ColumnMapping mapping : mappings) {
                Object value = readCell(row.getCell(mapping.columnIndex()), mapping, cellErrors);
                try {
                    mapping.field().set(dto, value);
                } catch (IllegalAccessException e) {
                    throw new IllegalStateException("Cannot set field: " + mapping.field().getName(), e);
                }
            }

            if (!cellErrors.isEmpty()) {
                parseErrors.add(RowError.builder()
                        .sheet(sheetName)
                        .rowNumber(excelRowNumber)
                        .cellErrors(cellErrors)
                        .build());
            }
            rows.add(dto);
            rowNumbers.add(excelRowNumber);
        }

        return new SheetRows<>(sheetName, rows, rowNumbers);
    }

    private List<ColumnMapping> resolveColumnMappings(String sheetName, Class<?> rowClass,
                                                      Row headerRow) {
        Map<Integer, String> headerMap = new LinkedHashMap<>();
        for (Cell cell : headerRow) {
            String value = getCellStringValue(cell);
            if (value != null && !value.isBlank()) {
                headerMap.put(cell.getColumnIndex(), value);
            }
        }

        List<ColumnMapping> mappings = new ArrayList<>();
        List<String> missing = new ArrayList<>();

        for (Field field : rowClass.getDeclaredFields()) {
            SheetColumn annotation = field.getAnnotation(SheetColumn.class);
            if (annotation == null) {
                continue;
            }
            int index = findColumn(annotation, headerMap);
            if (index < 0) {
                if (annotation.required()) {
                    missing.add(annotation.header());
                }
                continue;
            }
            field.setAccessible(true);
            mappings.add(new ColumnMapping(field, annotation, index,
                    CellReference.convertNumToColString(index)));
        }

        if (!missing.isEmpty()) {
            throw new ColumnResolutionException(sheetName, missing);
        }
        return mappings;
    }

    private int findColumn(SheetColumn annotation, Map<Integer, String> headerMap) {
        for (var entry : headerMap.entrySet()) {
            if (headerMatches(entry.getValue(), annotation.header())) {
                return entry.getKey();
            }
        }
        return -1;
    }

    private boolean headerMatches(String cellValue, String expected) {
        String actual = cellValue.trim().toLowerCase();
        String wanted = expected.trim().toLowerCase();
        if (actual.equals(wanted)) {
            return true;
        }
        // "min_gt"가 "min_gt_note" 같은 헤더에 걸리지 않도록 단어 경계까지 본다
        if (!actual.startsWith(wanted)) {
            return false;
        }
        char next = actual.charAt(wanted.length());
        return !Character.isLetterOrDigit(next) && next != '_';
    }

    private boolean isFooterRow(Row row) {
        String marker = config.getFooterMarker();
        if (marker == null || marker.isEmpty()) {
            return false;
        }
        for (Cell cell : row) {
            String value = getCellStringValue(cell);
            if (value != null && value.contains(marker)) {
                return true;
            }
        }
        return false;
    }

    private boolean isBlankRow(Row row) {
        for (Cell cell : row) {
            if (cell.getCellType() != CellType.BLANK) {
                String value = getCellStringValue(cell);
                if (value != null && !value.isBlank()) {
                    return false;
                }
            }
        }
        return true;
    }

    private Object readCell(Cell cell, ColumnMapping mapping, List<CellError> cellErrors) {
        if (cell == null || cell.getCellType() == CellType.BLANK) {
            return null;
        }

        Class<?> fieldType = mapping.field().getType();
        try {
            if (fieldType == BigDecimal.class) {
                return getBigDecimalValue(cell);
            } else if (fieldType == LocalDate.class) {
                return getLocalDateValue(cell, mapping.annotation().dateFormat());
            }
            String value = getCellStringValue(cell);
            return value == null || value.isEmpty() ? null : value;
        } catch (RuntimeException e) {
            String rawValue = getCellStringValue(cell);
            cellErrors.add(CellError.builder()
                    .columnLetter(mapping.columnLetter())
                    .fieldName(mapping.field().getName())
                    .headerName(mapping.annotation().header())
                    .rejectedValue(rawValue)
                    .message("'" + rawValue + "' 값을 " + fieldType.getSimpleName()
                            + " 타입으로 변환할 수 없습니다")
                    .build());
            return null;
        }
    }

    private BigDecimal getBigDecimalValue(Cell cell) {
        if (cell.getCellType() == CellType.NUMERIC) {
            BigDecimal value = BigDecimal.valueOf(cell.getNumericCellValue()).stripTrailingZeros();
            return value.scale() < 0 ? value.setScale(0) : value;
        }
        String value = getCellStringValue(cell);
        if (value == null || value.isBlank()) {
            return null;
        }
        return new BigDecimal(value.replaceAll("[,\\s]", ""));
    }

    private LocalDate getLocalDateValue(Cell cell, String dateFormat) {
        if (cell.getCellType() == CellType.NUMERIC && DateUtil.isCellDateFormatted(cell)) {
            return cell.getLocalDateTimeCellValue().toLocalDate();
        }
        String value = getCellStringValue(cell);
        if (value == null || value.isBlank()) {
            return null;
        }
        return LocalDate.parse(value, DateTimeFormatter.ofPattern(dateFormat));
    }

    private String getCellStringValue(Cell cell) {
        if (cell == null) {
            return null;
        }
        return DATA_FORMATTER.get().formatCellValue(cell).trim();
    }

    private List<String> requiredHeaders(Class<?> rowClass) {
        List<String> headers = new ArrayList<>();
        for (Field field : rowClass.getDeclaredFields()) {
            SheetColumn annotation = field.getAnnotation(SheetColumn.class);
            if (annotation != null && annotation.required()) {
                headers.add(annotation.header());
            }
        }
        return headers;
    }

    private static <T> T instantiate(Class<T> rowClass) {
        try {
            return rowClass.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalStateException("Cannot instantiate row type " + rowClass.getName(), e);
        }
    }
}
