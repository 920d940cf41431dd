package com.nosota.scholarship.calculation;

import com.nosota.scholarship.api.model.CalculationStrategy;
import com.nosota.scholarship.api.model.CourseLevel;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * base × CGPA multiplier × course multiplier.
 */
@Component
public class StandardFormula implements AmountFormula {

    private static final Map<CourseLevel, BigDecimal> COURSE_MULTIPLIERS = new EnumMap<>(CourseLevel.class);

    static {
        COURSE_MULTIPLIERS.put(CourseLevel.UNDERGRADUATE, new BigDecimal("1.0"));
        COURSE_MULTIPLIERS.put(CourseLevel.POSTGRADUATE, new BigDecimal("1.2"));
        COURSE_MULTIPLIERS.put(CourseLevel.DOCTORAL, new BigDecimal("1.5"));
        COURSE_MULTIPLIERS.put(CourseLevel.DIPLOMA, new BigDecimal("0.8"));
    }

    @Override
    public CalculationStrategy strategy() {
        return CalculationStrategy.STANDARD;
    }

    @Override
    public FormulaOutcome apply(CalculationFactors factors) {
        Map<String, BigDecimal> multipliers = new LinkedHashMap<>();
        multipliers.put("cgpa", cgpaMultiplier(factors.cgpa()));
        multipliers.put("course", COURSE_MULTIPLIERS.getOrDefault(factors.courseLevel(), BigDecimal.ONE));
        return FormulaOutcome.multiplied(factors.baseAmount(), multipliers);
    }

    static BigDecimal cgpaMultiplier(BigDecimal cgpa) {
        if (cgpa.compareTo(new BigDecimal("9.0")) >= 0) {
            return new BigDecimal("1.2");
        }
        if (cgpa.compareTo(new BigDecimal("8.0")) >= 0) {
            return new BigDecimal("1.1");
        }
        if (cgpa.compareTo(new BigDecimal("7.0")) >= 0) {
            return new BigDecimal("1.0");
        }
        if (cgpa.compareTo(new BigDecimal("6.0")) >= 0) {
            return new BigDecimal("0.9");
        }
        return new BigDecimal("0.8");
    }
}
