package com.foo.tariff.exception;

import com.foo.tariff.validation.RowError;
import lombok.Getter;

import java.util.List;

/** 게시 요청된 요율표가 행 검증 또는 정합성 검사를 통과하지 못했을 때. */
@Getter
public class InvalidScheduleException extends TariffEngineException {

    private final List<RowError> rowErrors;
    private final List<String> integrityProblems;

    private InvalidScheduleException(
            String message, List<RowError> rowErrors, List<String> integrityProblems) {
        super(message);
        this.rowErrors = List.copyOf(rowErrors);
        this.integrityProblems = List.copyOf(integrityProblems);
    }

    public static InvalidScheduleException rowErrors(List<RowError> rowErrors) {
        return new InvalidScheduleException(
                "Schedule rejected: %d row(s) failed validation".formatted(rowErrors.size()),
                rowErrors,
                List.of());
    }

    public static InvalidScheduleException integrity(List<String> problems) {
        return new InvalidScheduleException(
                "Schedule rejected: %d integrity problem(s)".formatted(problems.size()),
                List.of(),
                problems);
    }
}
