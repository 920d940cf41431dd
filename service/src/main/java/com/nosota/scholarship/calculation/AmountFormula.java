package com.nosota.scholarship.calculation;

import com.nosota.scholarship.api.model.CalculationStrategy;

/**
 * One calculation strategy. Implementations are pure: same factors, same outcome.
 */
public interface AmountFormula {

    CalculationStrategy strategy();

    FormulaOutcome apply(CalculationFactors factors);
}
