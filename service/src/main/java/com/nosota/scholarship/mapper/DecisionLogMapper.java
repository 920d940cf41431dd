package com.nosota.scholarship.mapper;

import com.nosota.scholarship.api.response.DecisionLogEntryResponse;
import com.nosota.scholarship.model.DecisionLogEntry;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface DecisionLogMapper {

    DecisionLogMapper INSTANCE = Mappers.getMapper(DecisionLogMapper.class);

    DecisionLogEntryResponse toResponse(DecisionLogEntry entry);

    List<DecisionLogEntryResponse> toResponseList(List<DecisionLogEntry> entries);
}
