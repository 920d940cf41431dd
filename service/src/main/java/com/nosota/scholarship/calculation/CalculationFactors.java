package com.nosota.scholarship.calculation;

import com.nosota.scholarship.api.model.CourseLevel;
import com.nosota.scholarship.api.model.LocationType;
import com.nosota.scholarship.api.model.ScholarshipType;
import com.nosota.scholarship.api.model.StateCategory;
import lombok.Builder;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Inputs of an amount calculation.
 *
 * @param baseAmount      Approved amount if set, else requested amount
 * @param cgpa            Student CGPA on a 10 point scale (0 when unknown)
 * @param courseLevel     Course level (UNDERGRADUATE when unknown)
 * @param scholarshipType Scholarship category
 * @param familyIncome    Annual family income (0 when unknown)
 * @param stateCategory   Reservation category (GENERAL when unknown)
 * @param location        Rural or urban (URBAN when unknown)
 * @param multipliers     Named custom multipliers, in insertion order
 * @param adjustments     Named custom adjustments, in insertion order
 */
@Builder
public record CalculationFactors(
        BigDecimal baseAmount,
        BigDecimal cgpa,
        CourseLevel courseLevel,
        ScholarshipType scholarshipType,
        BigDecimal familyIncome,
        StateCategory stateCategory,
        LocationType location,
        Map<String, BigDecimal> multipliers,
        Map<String, BigDecimal> adjustments
) {

    public CalculationFactors {
        if (baseAmount == null || baseAmount.signum() < 0) {
            throw new IllegalArgumentException("Base amount must be zero or positive: " + baseAmount);
        }
        cgpa = cgpa != null ? cgpa : BigDecimal.ZERO;
        courseLevel = courseLevel != null ? courseLevel : CourseLevel.UNDERGRADUATE;
        familyIncome = familyIncome != null ? familyIncome : BigDecimal.ZERO;
        stateCategory = stateCategory != null ? stateCategory : StateCategory.GENERAL;
        location = location != null ? location : LocationType.URBAN;
        multipliers = multipliers != null ? multipliers : Map.of();
        adjustments = adjustments != null ? adjustments : Map.of();
    }
}
