package com.nosota.scholarship.calculation;

import com.nosota.scholarship.api.model.CalculationStrategy;
import com.nosota.scholarship.api.model.RecommendationType;
import com.nosota.scholarship.api.response.AmountBreakdown;
import com.nosota.scholarship.api.response.CalculationResult;
import com.nosota.scholarship.api.response.Recommendation;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Computes scholarship amounts with one of the registered {@link AmountFormula}s.
 *
 * <p>The engine is side-effect free and reads no clock or random source: identical strategy
 * and factors always give an identical {@link CalculationResult}. The final amount is rounded
 * half-up to 2 decimals and split 70/25/5 into tuition, maintenance and books, with the
 * rounding remainder going to books so the parts add up to the total.
 */
@Component
public class AmountCalculationEngine {

    static final BigDecimal TUITION_SHARE = new BigDecimal("0.70");
    static final BigDecimal MAINTENANCE_SHARE = new BigDecimal("0.25");

    private static final BigDecimal HIGH_RATIO = new BigDecimal("1.2");
    private static final BigDecimal LOW_RATIO = new BigDecimal("0.5");
    private static final BigDecimal EXCELLENT_CGPA = new BigDecimal("9.0");

    private final Map<CalculationStrategy, AmountFormula> formulas = new EnumMap<>(CalculationStrategy.class);

    public AmountCalculationEngine(List<AmountFormula> formulas) {
        for (AmountFormula formula : formulas) {
            this.formulas.put(formula.strategy(), formula);
        }
    }

    /**
     * Calculates the amount for the given strategy.
     *
     * @param applicationId Application the calculation is for, echoed in the result (may be null)
     * @param strategy      Calculation strategy
     * @param factors       Calculation inputs
     * @return Calculation result
     * @throws IllegalArgumentException if no formula is registered for the strategy
     */
    public CalculationResult calculate(String applicationId, CalculationStrategy strategy, CalculationFactors factors) {
        AmountFormula formula = formulas.get(strategy);
        if (formula == null) {
            throw new IllegalArgumentException("Unsupported calculation strategy: " + strategy);
        }

        FormulaOutcome outcome = formula.apply(factors);
        BigDecimal finalAmount = outcome.amount().setScale(2, RoundingMode.HALF_UP);

        return new CalculationResult(
                applicationId,
                strategy,
                outcome.baseAmount().setScale(2, RoundingMode.HALF_UP),
                outcome.multipliers(),
                outcome.adjustments(),
                finalAmount,
                breakdown(finalAmount),
                recommendations(factors, finalAmount)
        );
    }

    public static AmountBreakdown breakdown(BigDecimal finalAmount) {
        BigDecimal tuition = finalAmount.multiply(TUITION_SHARE).setScale(2, RoundingMode.HALF_UP);
        BigDecimal maintenance = finalAmount.multiply(MAINTENANCE_SHARE).setScale(2, RoundingMode.HALF_UP);
        BigDecimal books = finalAmount.subtract(tuition).subtract(maintenance);
        return new AmountBreakdown(tuition, maintenance, books, finalAmount);
    }

    private static List<Recommendation> recommendations(CalculationFactors factors, BigDecimal finalAmount) {
        List<Recommendation> recommendations = new ArrayList<>();
        BigDecimal base = factors.baseAmount();

        if (finalAmount.compareTo(base.multiply(HIGH_RATIO)) > 0) {
            recommendations.add(new Recommendation(RecommendationType.WARNING,
                    "Calculated amount significantly exceeds requested amount",
                    "Review calculation parameters"));
        }
        if (finalAmount.compareTo(base.multiply(LOW_RATIO)) < 0) {
            recommendations.add(new Recommendation(RecommendationType.INFO,
                    "Calculated amount is much lower than requested",
                    "Consider need-based calculation"));
        }
        if (factors.cgpa().compareTo(EXCELLENT_CGPA) >= 0) {
            recommendations.add(new Recommendation(RecommendationType.SUCCESS,
                    "Excellent academic performance",
                    "Consider merit-based enhancement"));
        }
        return List.copyOf(recommendations);
    }
}
