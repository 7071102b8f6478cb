package com.foo.tariff.service.ingest;

import com.foo.tariff.exception.InvalidScheduleException;
import com.foo.tariff.model.Comparison;
import com.foo.tariff.model.EffectivePeriod;
import com.foo.tariff.model.ExemptionCondition;
import com.foo.tariff.model.FeeRule;
import com.foo.tariff.model.FlagCondition;
import com.foo.tariff.model.OperationalFlag;
import com.foo.tariff.model.RateTier;
import com.foo.tariff.model.RateUnit;
import com.foo.tariff.model.SurchargeRule;
import com.foo.tariff.model.TariffSchedule;
import com.foo.tariff.service.ingest.dto.ExemptionRow;
import com.foo.tariff.service.ingest.dto.FeeRuleRow;
import com.foo.tariff.service.ingest.dto.RateTierRow;
import com.foo.tariff.service.ingest.dto.SurchargeRow;
import com.foo.tariff.validation.CellError;
import com.foo.tariff.validation.RowError;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 검증을 통과한 행을 게시 전 요율표 초안으로 조립한다.
 *
 * <p>항구 코드와 통화는 대문자로, 플래그·단위·비교 연산자 코드는 enum으로 바꾼다. 규칙 통화가 비어 있으면 요율표
 * 통화를, 면제 비율이 비어 있으면 100을 쓴다. 알 수 없는 플래그 코드는 행 오류로 모아 한 번에 거부한다.
 */
@Component
public class TariffScheduleAssembler {

    public TariffSchedule assemble(
            String label,
            String currency,
            List<String> dueTypeOrder,
            SheetRows<RateTierRow> rateTierRows,
            SheetRows<FeeRuleRow> feeRuleRows,
            SheetRows<ExemptionRow> exemptionRows,
            SheetRows<SurchargeRow> surchargeRows) {
        String scheduleCurrency = currency.trim().toUpperCase();
        List<RowError> errors = new ArrayList<>();

        List<RateTier> tiers = new ArrayList<>();
        for (int i = 0; i < rateTierRows.size(); i++) {
            RowContext ctx = new RowContext(rateTierRows.sheet(), rateTierRows.rowNumber(i));
            RateTierRow row = rateTierRows.row(i);
            tiers.add(
                    RateTier.builder()
                            .ruleId(row.getRuleId().trim())
                            .port(normalizePort(row.getPort()))
                            .dueType(row.getDueType().trim())
                            .minGt(row.getMinGt())
                            .maxGt(row.getMaxGt())
                            .rate(row.getRate())
                            .unit(unit(row.getUnit()))
                            .baseFee(row.getBaseFee())
                            .minAmount(row.getMinAmount())
                            .maxAmount(row.getMaxAmount())
                            .currency(ruleCurrency(row.getCurrency(), scheduleCurrency))
                            .quantityFlag(optionalFlag(row.getQuantityFlag(), "quantityFlag", ctx))
                            .effectivePeriod(new EffectivePeriod(row.getEffectiveFrom(), row.getEffectiveTo()))
                            .build());
            ctx.drainInto(errors);
        }

        List<FeeRule> fees = new ArrayList<>();
        for (int i = 0; i < feeRuleRows.size(); i++) {
            RowContext ctx = new RowContext(feeRuleRows.sheet(), feeRuleRows.rowNumber(i));
            FeeRuleRow row = feeRuleRows.row(i);
            fees.add(
                    FeeRule.builder()
                            .ruleId(row.getRuleId().trim())
                            .port(normalizePort(row.getPort()))
                            .dueType(row.getDueType().trim())
                            .rate(row.getRate())
                            .unit(unit(row.getUnit()))
                            .baseFee(row.getBaseFee())
                            .minAmount(row.getMinAmount())
                            .maxAmount(row.getMaxAmount())
                            .currency(ruleCurrency(row.getCurrency(), scheduleCurrency))
                            .quantityFlag(optionalFlag(row.getQuantityFlag(), "quantityFlag", ctx))
                            .condition(
                                    optionalCondition(
                                            row.getConditionFlag(), row.getConditionOp(), row.getConditionValue(), ctx))
                            .effectivePeriod(new EffectivePeriod(row.getEffectiveFrom(), row.getEffectiveTo()))
                            .build());
            ctx.drainInto(errors);
        }

        List<ExemptionCondition> exemptions = new ArrayList<>();
        for (int i = 0; i < exemptionRows.size(); i++) {
            RowContext ctx = new RowContext(exemptionRows.sheet(), exemptionRows.rowNumber(i));
            ExemptionRow row = exemptionRows.row(i);
            exemptions.add(
                    ExemptionCondition.builder()
                            .ruleId(row.getRuleId().trim())
                            .port(normalizePort(row.getPort()))
                            .dueType(row.getDueType().trim())
                            .condition(
                                    optionalCondition(
                                            row.getConditionFlag(), row.getConditionOp(), row.getConditionValue(), ctx))
                            .discountPercent(
                                    row.getDiscountPercent() != null
                                            ? row.getDiscountPercent()
                                            : ExemptionCondition.FULL_EXEMPTION)
                            .reason(row.getReason().trim())
                            .effectivePeriod(new EffectivePeriod(row.getEffectiveFrom(), row.getEffectiveTo()))
                            .build());
            ctx.drainInto(errors);
        }

        List<SurchargeRule> surcharges = new ArrayList<>();
        for (int i = 0; i < surchargeRows.size(); i++) {
            RowContext ctx = new RowContext(surchargeRows.sheet(), surchargeRows.rowNumber(i));
            SurchargeRow row = surchargeRows.row(i);
            surcharges.add(
                    SurchargeRule.builder()
                            .ruleId(row.getRuleId().trim())
                            .port(normalizePort(row.getPort()))
                            .dueType(row.getDueType().trim())
                            .condition(
                                    optionalCondition(
                                            row.getConditionFlag(), row.getConditionOp(), row.getConditionValue(), ctx))
                            .percent(row.getPercent())
                            .reason(row.getReason().trim())
                            .effectivePeriod(new EffectivePeriod(row.getEffectiveFrom(), row.getEffectiveTo()))
                            .build());
            ctx.drainInto(errors);
        }

        if (!errors.isEmpty()) {
            throw InvalidScheduleException.rowErrors(errors);
        }

        return TariffSchedule.builder()
                .label(label.trim())
                .currency(scheduleCurrency)
                .dueTypeOrder(
                        dueTypeOrder == null
                                ? List.of()
                                : dueTypeOrder.stream().filter(d -> d != null && !d.isBlank()).map(String::trim).toList())
                .rateTiers(tiers)
                .feeRules(fees)
                .exemptions(exemptions)
                .surcharges(surcharges)
                .build();
    }

    private static String normalizePort(String port) {
        return port.trim().toUpperCase();
    }

    private static String ruleCurrency(String rowCurrency, String scheduleCurrency) {
        return rowCurrency == null || rowCurrency.isBlank()
                ? scheduleCurrency
                : rowCurrency.trim().toUpperCase();
    }

    // @Pattern 검증을 통과한 코드만 들어온다
    private static RateUnit unit(String code) {
        return RateUnit.fromCode(code)
                .orElseThrow(() -> new IllegalStateException("Unvalidated rate unit: " + code));
    }

    private static OperationalFlag optionalFlag(String code, String field, RowContext ctx) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return OperationalFlag.fromCode(code)
                .orElseGet(
                        () -> {
                            ctx.reject(field, code, "알 수 없는 운항 플래그입니다: " + code.trim());
                            return null;
                        });
    }

    private static FlagCondition optionalCondition(
            String flagCode, String op, String value, RowContext ctx) {
        boolean hasFlag = flagCode != null && !flagCode.isBlank();
        if (!hasFlag) {
            if ((op != null && !op.isBlank()) || (value != null && !value.isBlank())) {
                ctx.reject("conditionFlag", flagCode, "condition_op/condition_value에는 condition_flag가 필요합니다");
            }
            return null;
        }
        if (value == null || value.isBlank()) {
            ctx.reject("conditionValue", value, "condition_flag에는 condition_value가 필요합니다");
            return null;
        }
        OperationalFlag flag = optionalFlag(flagCode, "conditionFlag", ctx);
        if (flag == null) {
            return null;
        }
        Comparison comparison =
                op == null || op.isBlank()
                        ? Comparison.EQ
                        : Comparison.fromCode(op)
                                .orElseThrow(() -> new IllegalStateException("Unvalidated comparison: " + op));
        return FlagCondition.builder()
                .flag(flag)
                .comparison(comparison)
                .value(value.trim().toLowerCase())
                .build();
    }

    /** 한 행을 조립하는 동안 나온 오류. */
    private static final class RowContext {
        private final String sheet;
        private final int rowNumber;
        private final List<CellError> cellErrors = new ArrayList<>();

        RowContext(String sheet, int rowNumber) {
            this.sheet = sheet;
            this.rowNumber = rowNumber;
        }

        void reject(String field, Object rejectedValue, String message) {
            cellErrors.add(
                    CellError.builder().fieldName(field).rejectedValue(rejectedValue).message(message).build());
        }

        void drainInto(List<RowError> errors) {
            if (!cellErrors.isEmpty()) {
                errors.add(
                        RowError.builder().sheet(sheet).rowNumber(rowNumber).cellErrors(cellErrors).build());
            }
        }
    }
}
