package com.foo.tariff.service.ingest;

import com.foo.tariff.config.TariffEngineProperties;
import com.foo.tariff.util.SecureWorkbookUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class ScheduleWorkbookFileService {

    private final TariffEngineProperties properties;

    /**
     * 업로드된 .xlsx 파일을 임시 디렉터리에 저장하고 내용을 검증한다. 호출자가 사용 후 삭제한다.
     */
    public Path storeAndValidateXlsx(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("업로드된 파일이 비어 있습니다");
        }

        long maxBytes = (long) properties.getMaxWorkbookSizeMb() * 1024 * 1024;
        if (file.getSize() > maxBytes) {
            throw new IllegalArgumentException(
                    "파일 크기가 최대 %dMB를 초과합니다".formatted(properties.getMaxWorkbookSizeMb()));
        }

        String originalName = file.getOriginalFilename();
        if (originalName == null) {
            throw new IllegalArgumentException("파일명이 없습니다");
        }
        String lowerOriginalName = originalName.trim().toLowerCase();
        if (lowerOriginalName.endsWith(".xls")) {
            throw new IllegalArgumentException("지원하지 않는 파일 형식입니다. .xlsx 파일만 업로드 가능합니다.");
        }
        if (!lowerOriginalName.endsWith(".xlsx")) {
            throw new IllegalArgumentException("유효하지 않은 파일 확장자입니다.");
        }

        String safeName = SecureWorkbookUtils.sanitizeFilename(originalName);
        Path tempDir = properties.getTempDirectoryPath();
        Files.createDirectories(tempDir);

        // 동시 업로드끼리 같은 파일명을 쓰지 않도록 접두어를 붙인다
        Path targetPath = tempDir.resolve(UUID.randomUUID() + "_" + safeName);
        file.transferTo(targetPath);
        try {
            SecureWorkbookUtils.validateFileContent(targetPath);
        } catch (SecurityException | IOException e) {
            Files.deleteIfExists(targetPath);
            throw e;
        }
        return targetPath;
    }
}
