package com.nosota.scholarship.calculation;

import com.nosota.scholarship.api.model.CalculationStrategy;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * max(0, base × Π multipliers + Σ adjustments) with caller supplied factors.
 * Multipliers are clamped into [0.1, 5.0] and adjustments into [-50000, 50000].
 */
@Component
public class CustomFormula implements AmountFormula {

    static final BigDecimal MIN_MULTIPLIER = new BigDecimal("0.1");
    static final BigDecimal MAX_MULTIPLIER = new BigDecimal("5.0");
    static final BigDecimal MIN_ADJUSTMENT = new BigDecimal("-50000");
    static final BigDecimal MAX_ADJUSTMENT = new BigDecimal("50000");

    @Override
    public CalculationStrategy strategy() {
        return CalculationStrategy.CUSTOM;
    }

    @Override
    public FormulaOutcome apply(CalculationFactors factors) {
        Map<String, BigDecimal> multipliers = new LinkedHashMap<>();
        BigDecimal amount = factors.baseAmount();
        for (Map.Entry<String, BigDecimal> entry : factors.multipliers().entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            BigDecimal multiplier = clamp(entry.getValue(), MIN_MULTIPLIER, MAX_MULTIPLIER);
            multipliers.put(entry.getKey(), multiplier);
            amount = amount.multiply(multiplier);
        }

        Map<String, BigDecimal> adjustments = new LinkedHashMap<>();
        for (Map.Entry<String, BigDecimal> entry : factors.adjustments().entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            BigDecimal adjustment = clamp(entry.getValue(), MIN_ADJUSTMENT, MAX_ADJUSTMENT);
            adjustments.put(entry.getKey(), adjustment);
            amount = amount.add(adjustment);
        }

        return new FormulaOutcome(factors.baseAmount(),
                Collections.unmodifiableMap(multipliers),
                Collections.unmodifiableMap(adjustments),
                amount.max(BigDecimal.ZERO));
    }

    private static BigDecimal clamp(BigDecimal value, BigDecimal min, BigDecimal max) {
        return value.max(min).min(max);
    }
}
