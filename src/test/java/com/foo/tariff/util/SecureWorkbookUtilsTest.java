package com.foo.tariff.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

class SecureWorkbookUtilsTest {

    @TempDir Path tempDir;

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "   ", "\t"})
    void sanitizeFilename_nullOrBlank_throws(String input) {
        assertThatThrownBy(() -> SecureWorkbookUtils.sanitizeFilename(input))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sanitizeFilename_pathTraversal_keepsFilenameOnly() {
        assertThat(SecureWorkbookUtils.sanitizeFilename("../../../etc/tariffs.xlsx"))
                .isEqualTo("tariffs.xlsx");
        assertThat(SecureWorkbookUtils.sanitizeFilename("C:\\Users\\ops\\durban 2024.xlsx"))
                .isEqualTo("durban 2024.xlsx");
    }

    @Test
    void sanitizeFilename_controlAndSpecialCharacters_replaced() {
        assertThat(SecureWorkbookUtils.sanitizeFilename("dur\u0000\u0001.xlsx")).isEqualTo("dur.xlsx");
        assertThat(SecureWorkbookUtils.sanitizeFilename("dur<cpt>.xlsx")).isEqualTo("dur_cpt_.xlsx");
        assertThat(SecureWorkbookUtils.sanitizeFilename("dur..2024.xlsx")).isEqualTo("dur.2024.xlsx");
    }

    @Test
    void sanitizeFilename_koreanKept() {
        assertThat(SecureWorkbookUtils.sanitizeFilename("항만요율표.xlsx")).isEqualTo("항만요율표.xlsx");
    }

    @Test
    void sanitizeFilename_wrongExtension_throws() {
        assertThatThrownBy(() -> SecureWorkbookUtils.sanitizeFilename("tariffs.csv"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void validateFileContent_realWorkbook_passes() throws IOException {
        Path file = tempDir.resolve("real.xlsx");
        try (Workbook workbook = new XSSFWorkbook();
                OutputStream out = Files.newOutputStream(file)) {
            workbook.createSheet("FeeRules");
            workbook.write(out);
        }

        assertThatCode(() -> SecureWorkbookUtils.validateFileContent(file)).doesNotThrowAnyException();
        try (Workbook opened = SecureWorkbookUtils.openWorkbook(file)) {
            assertThat(opened.getSheet("FeeRules")).isNotNull();
        }
    }

    @Test
    void validateFileContent_disguisedFile_throwsSecurityException() throws IOException {
        Path file = tempDir.resolve("disguised.xlsx");
        Files.writeString(file, "rule_id,port,rate");

        assertThatThrownBy(() -> SecureWorkbookUtils.validateFileContent(file))
                .isInstanceOf(SecurityException.class);
    }

    @Test
    void validateFileContent_tooSmall_throwsSecurityException() throws IOException {
        Path file = tempDir.resolve("tiny.xlsx");
        Files.write(file, new byte[] {0x50, 0x4B});

        assertThatThrownBy(() -> SecureWorkbookUtils.validateFileContent(file))
                .isInstanceOf(SecurityException.class)
                .hasMessageContaining("too small");
    }
}
