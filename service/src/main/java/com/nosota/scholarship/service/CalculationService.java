package com.nosota.scholarship.service;

import com.nosota.scholarship.api.request.CalculationRequest;
import com.nosota.scholarship.api.request.CustomFactors;
import com.nosota.scholarship.api.response.CalculationResult;
import com.nosota.scholarship.calculation.AmountCalculationEngine;
import com.nosota.scholarship.calculation.CalculationFactors;
import com.nosota.scholarship.error.ApplicationNotFoundException;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.repository.ApplicationRepository;
import com.nosota.scholarship.security.AccessPolicy;
import com.nosota.scholarship.security.Actor;
import com.nosota.scholarship.security.Capability;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

/**
 * Feeds an application's data and caller supplied factors to the calculation engine.
 * Read only; the result is advisory and is not stored.
 */
@Service
@Validated
@RequiredArgsConstructor
@Slf4j
public class CalculationService {

    private final ApplicationRepository applicationRepository;
    private final AmountCalculationEngine engine;
    private final AccessPolicy accessPolicy;

    public CalculationResult calculateAmount(@NotBlank String applicationId, @Valid @NotNull CalculationRequest request,
                                             @NotNull Actor actor) {
        Application application = applicationRepository.findByApplicationId(applicationId)
                .orElseThrow(() -> new ApplicationNotFoundException(applicationId));
        accessPolicy.check(actor, Capability.CALCULATE_AMOUNT, application);

        CalculationResult result = engine.calculate(applicationId, request.strategy(),
                factors(application, request.customFactors()));

        log.debug("Calculated {} for application {}: base={}, final={}",
                request.strategy(), applicationId, result.baseAmount(), result.finalAmount());
        return result;
    }

    static CalculationFactors factors(Application application, CustomFactors custom) {
        CalculationFactors.CalculationFactorsBuilder builder = CalculationFactors.builder()
                .baseAmount(application.getApprovedAmount() != null
                        ? application.getApprovedAmount()
                        : application.getRequestedAmount())
                .cgpa(application.getStudentCgpa())
                .courseLevel(application.getCourseLevel())
                .scholarshipType(application.getScholarshipType());

        if (custom != null) {
            builder.familyIncome(custom.familyIncome())
                    .stateCategory(custom.stateCategory())
                    .location(custom.location())
                    .multipliers(custom.multipliers())
                    .adjustments(custom.adjustments());
        }
        return builder.build();
    }
}
