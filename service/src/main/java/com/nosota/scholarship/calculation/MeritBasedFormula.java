package com.nosota.scholarship.calculation;

import com.nosota.scholarship.api.model.CalculationStrategy;
import com.nosota.scholarship.api.model.ScholarshipType;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * base × merit multiplier × scholarship type bonus.
 */
@Component
public class MeritBasedFormula implements AmountFormula {

    private static final Map<ScholarshipType, BigDecimal> TYPE_BONUSES = new EnumMap<>(ScholarshipType.class);

    static {
        TYPE_BONUSES.put(ScholarshipType.RESEARCH, new BigDecimal("1.2"));
        TYPE_BONUSES.put(ScholarshipType.SPORTS, new BigDecimal("1.1"));
        TYPE_BONUSES.put(ScholarshipType.ARTS, new BigDecimal("1.1"));
        TYPE_BONUSES.put(ScholarshipType.MERIT, new BigDecimal("1.0"));
    }

    @Override
    public CalculationStrategy strategy() {
        return CalculationStrategy.MERIT_BASED;
    }

    @Override
    public FormulaOutcome apply(CalculationFactors factors) {
        Map<String, BigDecimal> multipliers = new LinkedHashMap<>();
        multipliers.put("merit", meritMultiplier(factors.cgpa()));
        multipliers.put("typeBonus", factors.scholarshipType() == null
                ? BigDecimal.ONE
                : TYPE_BONUSES.getOrDefault(factors.scholarshipType(), BigDecimal.ONE));
        return FormulaOutcome.multiplied(factors.baseAmount(), multipliers);
    }

    static BigDecimal meritMultiplier(BigDecimal cgpa) {
        if (cgpa.compareTo(new BigDecimal("9.5")) >= 0) {
            return new BigDecimal("1.5");
        }
        if (cgpa.compareTo(new BigDecimal("9.0")) >= 0) {
            return new BigDecimal("1.3");
        }
        if (cgpa.compareTo(new BigDecimal("8.5")) >= 0) {
            return new BigDecimal("1.2");
        }
        if (cgpa.compareTo(new BigDecimal("8.0")) >= 0) {
            return new BigDecimal("1.1");
        }
        return new BigDecimal("1.0");
    }
}
