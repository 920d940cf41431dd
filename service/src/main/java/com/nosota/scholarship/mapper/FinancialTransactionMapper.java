package com.nosota.scholarship.mapper;

import com.nosota.scholarship.api.response.FinancialTransactionResponse;
import com.nosota.scholarship.model.FinancialTransaction;
import org.mapstruct.Mapper;
import org.mapstruct.factory.Mappers;

import java.util.List;

@Mapper
public interface FinancialTransactionMapper {

    FinancialTransactionMapper INSTANCE = Mappers.getMapper(FinancialTransactionMapper.class);

    FinancialTransactionResponse toResponse(FinancialTransaction transaction);

    List<FinancialTransactionResponse> toResponseList(List<FinancialTransaction> transactions);
}
