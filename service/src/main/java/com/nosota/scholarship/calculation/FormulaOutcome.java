package com.nosota.scholarship.calculation;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unrounded result of one formula.
 *
 * @param baseAmount  Base the formula started from
 * @param multipliers Applied multipliers, in application order
 * @param adjustments Applied additive adjustments, in application order
 * @param amount      Unrounded result
 */
public record FormulaOutcome(
        BigDecimal baseAmount,
        Map<String, BigDecimal> multipliers,
        Map<String, BigDecimal> adjustments,
        BigDecimal amount
) {

    /**
     * base × Π multipliers, with no adjustments.
     */
    public static FormulaOutcome multiplied(BigDecimal baseAmount, Map<String, BigDecimal> multipliers) {
        BigDecimal amount = baseAmount;
        for (BigDecimal multiplier : multipliers.values()) {
            amount = amount.multiply(multiplier);
        }
        return new FormulaOutcome(baseAmount, Collections.unmodifiableMap(new LinkedHashMap<>(multipliers)),
                Map.of(), amount);
    }
}
