package com.nosota.scholarship.calculation;

import com.nosota.scholarship.api.model.CalculationStrategy;
import com.nosota.scholarship.api.model.CourseLevel;
import com.nosota.scholarship.api.model.LocationType;
import com.nosota.scholarship.api.model.StateCategory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fixed scheme base by course level × category multiplier × location multiplier.
 * The requested amount is ignored.
 */
@Component
public class GovernmentSchemeFormula implements AmountFormula {

    private static final BigDecimal DEFAULT_BASE = new BigDecimal("30000");
    private static final Map<CourseLevel, BigDecimal> SCHEME_BASES = new EnumMap<>(CourseLevel.class);
    private static final Map<StateCategory, BigDecimal> CATEGORY_MULTIPLIERS = new EnumMap<>(StateCategory.class);

    static {
        SCHEME_BASES.put(CourseLevel.UNDERGRADUATE, new BigDecimal("30000"));
        SCHEME_BASES.put(CourseLevel.POSTGRADUATE, new BigDecimal("40000"));
        SCHEME_BASES.put(CourseLevel.DOCTORAL, new BigDecimal("60000"));
        SCHEME_BASES.put(CourseLevel.DIPLOMA, new BigDecimal("20000"));

        CATEGORY_MULTIPLIERS.put(StateCategory.SC, new BigDecimal("1.2"));
        CATEGORY_MULTIPLIERS.put(StateCategory.ST, new BigDecimal("1.2"));
        CATEGORY_MULTIPLIERS.put(StateCategory.OBC, new BigDecimal("1.1"));
        CATEGORY_MULTIPLIERS.put(StateCategory.GENERAL, new BigDecimal("1.0"));
        CATEGORY_MULTIPLIERS.put(StateCategory.MINORITY, new BigDecimal("1.15"));
    }

    @Override
    public CalculationStrategy strategy() {
        return CalculationStrategy.GOVERNMENT_SCHEME;
    }

    @Override
    public FormulaOutcome apply(CalculationFactors factors) {
        BigDecimal schemeBase = SCHEME_BASES.getOrDefault(factors.courseLevel(), DEFAULT_BASE);

        Map<String, BigDecimal> multipliers = new LinkedHashMap<>();
        multipliers.put("category", CATEGORY_MULTIPLIERS.getOrDefault(factors.stateCategory(), BigDecimal.ONE));
        multipliers.put("location", factors.location() == LocationType.RURAL ? new BigDecimal("1.1") : BigDecimal.ONE);
        return FormulaOutcome.multiplied(schemeBase, multipliers);
    }
}
