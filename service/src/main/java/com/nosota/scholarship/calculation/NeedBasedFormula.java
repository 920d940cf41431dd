package com.nosota.scholarship.calculation;

import com.nosota.scholarship.api.model.CalculationStrategy;
import com.nosota.scholarship.api.model.CourseLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * base × income multiplier × course adjustment. Lower family income raises the amount.
 */
@Component
public class NeedBasedFormula implements AmountFormula {

    private static final Map<CourseLevel, BigDecimal> COURSE_ADJUSTMENTS = new EnumMap<>(CourseLevel.class);

    static {
        COURSE_ADJUSTMENTS.put(CourseLevel.UNDERGRADUATE, new BigDecimal("1.0"));
        COURSE_ADJUSTMENTS.put(CourseLevel.POSTGRADUATE, new BigDecimal("1.1"));
        COURSE_ADJUSTMENTS.put(CourseLevel.DOCTORAL, new BigDecimal("1.2"));
        COURSE_ADJUSTMENTS.put(CourseLevel.DIPLOMA, new BigDecimal("0.9"));
    }

    @Override
    public CalculationStrategy strategy() {
        return CalculationStrategy.NEED_BASED;
    }

    @Override
    public FormulaOutcome apply(CalculationFactors factors) {
        Map<String, BigDecimal> multipliers = new LinkedHashMap<>();
        multipliers.put("income", incomeMultiplier(factors.familyIncome()));
        multipliers.put("course", COURSE_ADJUSTMENTS.getOrDefault(factors.courseLevel(), BigDecimal.ONE));
        return FormulaOutcome.multiplied(factors.baseAmount(), multipliers);
    }

    static BigDecimal incomeMultiplier(BigDecimal income) {
        if (income.compareTo(new BigDecimal("100000")) <= 0) {
            return new BigDecimal("1.5");
        }
        if (income.compareTo(new BigDecimal("200000")) <= 0) {
            return new BigDecimal("1.3");
        }
        if (income.compareTo(new BigDecimal("400000")) <= 0) {
            return new BigDecimal("1.1");
        }
        if (income.compareTo(new BigDecimal("600000")) <= 0) {
            return new BigDecimal("0.9");
        }
        return new BigDecimal("0.7");
    }
}
