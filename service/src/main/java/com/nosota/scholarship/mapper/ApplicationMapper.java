package com.nosota.scholarship.mapper;

import com.nosota.scholarship.api.response.ApplicationResponse;
import com.nosota.scholarship.api.response.FinanceForwardResponse;
import com.nosota.scholarship.api.response.StageDecisionResponse;
import com.nosota.scholarship.api.response.StageDecisionsResponse;
import com.nosota.scholarship.dto.ReplayedDecisions;
import com.nosota.scholarship.model.Application;
import com.nosota.scholarship.model.FinanceForward;
import com.nosota.scholarship.model.StageDecision;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.factory.Mappers;

/**
 * MapStruct mapper for Application entity to ApplicationResponse conversion.
 */
@Mapper
public interface ApplicationMapper {

    ApplicationMapper INSTANCE = Mappers.getMapper(ApplicationMapper.class);

    /**
     * Maps an application together with its derived overdue flag.
     *
     * @param application Application entity
     * @param overdue     Whether the review SLA is exceeded
     * @return ApplicationResponse
     */
    @Mapping(target = "overdue", source = "overdue")
    ApplicationResponse toResponse(Application application, boolean overdue);

    StageDecisionResponse toResponse(StageDecision decision);

    FinanceForwardResponse toResponse(FinanceForward forward);

    @Mapping(target = "instituteDecision", source = "decisions.instituteDecision")
    @Mapping(target = "departmentDecision", source = "decisions.departmentDecision")
    @Mapping(target = "financeForward", source = "decisions.financeForward")
    @Mapping(target = "entryCount", source = "decisions.entryCount")
    StageDecisionsResponse toResponse(ReplayedDecisions replayed);
}
