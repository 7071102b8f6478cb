package com.foo.tariff.controller;

import com.foo.tariff.model.CalculationResult;
import com.foo.tariff.service.PortDuesCalculationService;
import com.foo.tariff.service.guardrail.RawCalculationRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class PortDuesApiController {

    private final PortDuesCalculationService calculationService;

    // 입력 검증은 GuardrailValidator가 한다
    @PostMapping("/api/tariff/calculate")
    public ResponseEntity<CalculationResult> calculate(@RequestBody RawCalculationRequest request) {
        return ResponseEntity.ok(calculationService.calculate(request));
    }
}
