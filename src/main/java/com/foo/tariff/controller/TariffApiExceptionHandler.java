package com.foo.tariff.controller;

import com.foo.tariff.exception.AmbiguousTierException;
import com.foo.tariff.exception.DueCalculationException;
import com.foo.tariff.exception.InvalidScheduleException;
import com.foo.tariff.exception.RequestValidationException;
import com.foo.tariff.exception.TariffNotFoundException;
import com.foo.tariff.service.ingest.ColumnResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * API 오류 응답. 본문은 항상 {@code {"success": false, "message": ...}} 형태이며 호출자가 고칠 수 있는 오류만
 * 세부 항목을 덧붙인다. 요율표 데이터 결함은 내부 정보를 숨긴 500으로 응답한다.
 */
@Slf4j
@RestControllerAdvice(basePackageClasses = PortDuesApiController.class)
public class TariffApiExceptionHandler {

    static final String CALCULATION_FAILED_MESSAGE = "요금 계산 중 오류가 발생했습니다. 관리자에게 문의하세요.";

    @ExceptionHandler(RequestValidationException.class)
    public ResponseEntity<Map<String, Object>> handleRequestValidation(
            RequestValidationException e) {
        log.warn("계산 요청 거부: field={}, constraint={}", e.getField(), e.getConstraint());
        Map<String, Object> body = errorBody(e.getMessage());
        body.put("field", e.getField());
        body.put("constraint", e.getConstraint());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(TariffNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(TariffNotFoundException e) {
        log.warn("요율표 없음: {}", e.getMessage());
        String message =
                e.getRequestedVersion() != null
                        ? "항구 '%s'를 포함하는 요율표 버전 %d이 없습니다".formatted(e.getPort(), e.getRequestedVersion())
                        : "항구 '%s'를 포함하는 요율표가 없습니다".formatted(e.getPort());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody(message));
    }

    @ExceptionHandler(AmbiguousTierException.class)
    public ResponseEntity<Map<String, Object>> handleAmbiguousTier(AmbiguousTierException e) {
        log.error(
                "요율표 v{} 구간 중복: port={}, dueType={}, ruleIds={}",
                e.getScheduleVersion(),
                e.getPort(),
                e.getDueType(),
                e.getRuleIds());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(CALCULATION_FAILED_MESSAGE));
    }

    @ExceptionHandler(DueCalculationException.class)
    public ResponseEntity<Map<String, Object>> handleCalculation(DueCalculationException e) {
        log.error(
                "요율표 v{} 규칙 {} 계산 실패: {}", e.getScheduleVersion(), e.getRuleId(), e.getMessage(), e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody(CALCULATION_FAILED_MESSAGE));
    }

    @ExceptionHandler(InvalidScheduleException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidSchedule(InvalidScheduleException e) {
        log.warn("요율표 게시 거부: {}", e.getMessage());
        Map<String, Object> body = errorBody("요율표 검증에 실패했습니다");
        if (!e.getRowErrors().isEmpty()) {
            body.put("rowErrors", e.getRowErrors());
        }
        if (!e.getIntegrityProblems().isEmpty()) {
            body.put("problems", e.getIntegrityProblems());
        }
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(ColumnResolutionException.class)
    public ResponseEntity<Map<String, Object>> handleColumnResolution(ColumnResolutionException e) {
        log.warn("워크북 컬럼 확인 실패: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(e.toKoreanMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        log.warn("요청 본문 해석 실패: {}", e.getMessage());
        Map<String, Object> body = errorBody("요청 본문을 해석할 수 없습니다");
        body.put("field", "request");
        body.put("constraint", "json");
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("요청 오류: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody(e.getMessage()));
    }

    @ExceptionHandler(SecurityException.class)
    public ResponseEntity<Map<String, Object>> handleSecurity(SecurityException e) {
        log.warn("업로드 보안 검증 실패: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody("파일 보안 검증에 실패했습니다"));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<Map<String, Object>> handleMaxUploadSize(MaxUploadSizeExceededException e) {
        log.warn("업로드 파일 크기 초과: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(errorBody("업로드 파일 크기가 제한을 초과했습니다."));
    }

    @ExceptionHandler({MultipartException.class, MissingServletRequestPartException.class})
    public ResponseEntity<Map<String, Object>> handleMultipartException(Exception e) {
        log.warn("멀티파트 요청 오류: {}", e.getMessage());
        return ResponseEntity.badRequest().body(errorBody("멀티파트 요청 처리 중 오류가 발생했습니다."));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception e) {
        log.error("요청 처리 실패", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(errorBody("요청 처리 중 오류가 발생했습니다. 관리자에게 문의하세요."));
    }

    private Map<String, Object> errorBody(String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("message", message);
        return body;
    }
}
