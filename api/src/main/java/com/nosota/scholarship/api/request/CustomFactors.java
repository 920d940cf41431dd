package com.nosota.scholarship.api.request;

import com.nosota.scholarship.api.model.LocationType;
import com.nosota.scholarship.api.model.StateCategory;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Caller supplied inputs for the calculation engine.
 *
 * @param familyIncome  Annual family income (need based strategy), 0 when omitted
 * @param stateCategory Reservation category (government scheme), GENERAL when omitted
 * @param location      Rural or urban (government scheme), URBAN when omitted
 * @param multipliers   Named multipliers (custom strategy), clamped to [0.1, 5.0]
 * @param adjustments   Named adjustments (custom strategy), clamped to [-50000, 50000]
 */
public record CustomFactors(
        @PositiveOrZero
        BigDecimal familyIncome,
        StateCategory stateCategory,
        LocationType location,
        Map<String, BigDecimal> multipliers,
        Map<String, BigDecimal> adjustments
) {
}
