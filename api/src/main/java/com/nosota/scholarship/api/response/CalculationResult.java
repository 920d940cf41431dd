package com.nosota.scholarship.api.response;

import com.nosota.scholarship.api.model.CalculationStrategy;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Result of an amount calculation. Contains no timestamps so identical inputs
 * always produce identical output.
 *
 * @param applicationId   Application the calculation was made for (null for direct engine calls)
 * @param strategy        Strategy used
 * @param baseAmount      Base amount the multipliers were applied to
 * @param multipliers     Applied multipliers by name, in application order
 * @param adjustments     Applied additive adjustments by name, in application order
 * @param finalAmount     Final amount rounded half-up to 2 decimals
 * @param breakdown       Tuition / maintenance / books split
 * @param recommendations Advisory notes for the finance reviewer
 */
public record CalculationResult(
        String applicationId,
        CalculationStrategy strategy,
        BigDecimal baseAmount,
        Map<String, BigDecimal> multipliers,
        Map<String, BigDecimal> adjustments,
        BigDecimal finalAmount,
        AmountBreakdown breakdown,
        List<Recommendation> recommendations
) {
}
