package com.foo.tariff.util;

import org.apache.poi.openxml4j.opc.OPCPackage;
import org.apache.poi.openxml4j.opc.PackageAccess;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.util.IOUtils;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 업로드된 요율표 워크북을 안전하게 여는 유틸리티.
 *
 * <p>XLSX 시그니처 확인, 파일명 정리, POI 할당 상한을 담당한다.
 */
public final class SecureWorkbookUtils {

    // 요율표 워크북은 작다. 비정상적으로 큰 레코드는 zip bomb으로 본다.
    private static final int MAX_BYTE_ARRAY_SIZE = 50_000_000;

    // ZIP 로컬 파일 헤더(PK\3\4)
    private static final byte[] XLSX_MAGIC = {0x50, 0x4B, 0x03, 0x04};

    static {
        IOUtils.setByteArrayMaxOverride(MAX_BYTE_ARRAY_SIZE);
    }

    private SecureWorkbookUtils() {}

    /**
     * 시그니처를 확인한 뒤 읽기 전용으로 워크북을 연다.
     *
     * @throws SecurityException 내용이 XLSX가 아닐 때
     */
    public static Workbook openWorkbook(Path path) throws IOException {
        validateFileContent(path);
        try {
            OPCPackage pkg = OPCPackage.open(path.toFile(), PackageAccess.READ);
            return new XSSFWorkbook(pkg);
        } catch (Exception e) {
            throw new IOException("Failed to open XLSX file securely: " + e.getMessage(), e);
        }
    }

    /** 확장자가 .xlsx이고 내용이 ZIP 시그니처로 시작하는지 확인한다. */
    public static void validateFileContent(Path path) throws IOException {
        String fileName = path.getFileName().toString().toLowerCase();
        if (!fileName.endsWith(".xlsx")) {
            throw new SecurityException("Only .xlsx files are supported.");
        }
        byte[] header = new byte[XLSX_MAGIC.length];
        try (InputStream is = Files.newInputStream(path)) {
            if (is.readNBytes(header, 0, header.length) < header.length) {
                throw new SecurityException("File is too small to be a valid XLSX workbook");
            }
        }
        for (int i = 0; i < XLSX_MAGIC.length; i++) {
            if (header[i] != XLSX_MAGIC[i]) {
                throw new SecurityException(
                        "File content does not match XLSX format. The file may be corrupted or disguised.");
            }
        }
    }

    /**
     * 경로 구성요소와 제어 문자를 제거한 파일명을 반환한다.
     *
     * @throws IllegalArgumentException 정리 후 비어 있거나 .xlsx가 아닐 때
     */
    public static String sanitizeFilename(String originalFilename) {
        if (originalFilename == null || originalFilename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }

        String filename = originalFilename;
        int lastSlash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (lastSlash >= 0) {
            filename = filename.substring(lastSlash + 1);
        }

        filename = filename.replaceAll("[\\x00-\\x1F\\x7F]", "");
        filename = filename.replaceAll("[^a-zA-Z0-9.\\-_\\s\\uAC00-\\uD7AF]", "_");
        filename = filename.replaceAll("\\.{2,}", ".");
        filename = filename.replaceAll("^[.\\s]+|[.\\s]+$", "");

        if (filename.isBlank()) {
            throw new IllegalArgumentException("Filename is invalid after sanitization");
        }
        if (!filename.toLowerCase().endsWith(".xlsx")) {
            throw new IllegalArgumentException("Invalid file extension");
        }
        return filename;
    }
}
