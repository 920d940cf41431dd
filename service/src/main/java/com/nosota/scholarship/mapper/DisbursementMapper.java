package com.nosota.scholarship.mapper;

import com.nosota.scholarship.api.response.DisbursementComponentResponse;
import com.nosota.scholarship.api.response.DisbursementResponse;
import com.nosota.scholarship.model.ComponentPayment;
import com.nosota.scholarship.model.Disbursement;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;
import org.mapstruct.factory.Mappers;

/**
 * MapStruct mapper for Disbursement entity to DisbursementResponse conversion.
 * The bank account number leaves the service masked to its last four digits.
 */
@Mapper
public interface DisbursementMapper {

    DisbursementMapper INSTANCE = Mappers.getMapper(DisbursementMapper.class);

    @Mapping(target = "bankAccountNumber", source = "bankAccountNumber", qualifiedByName = "maskAccount")
    DisbursementResponse toResponse(Disbursement disbursement);

    DisbursementComponentResponse toComponentResponse(ComponentPayment component);

    @Named("maskAccount")
    default String maskAccount(String accountNumber) {
        if (accountNumber == null || accountNumber.isBlank()) {
            return null;
        }
        if (accountNumber.length() <= 4) {
            return "****";
        }
        return "****" + accountNumber.substring(accountNumber.length() - 4);
    }
}
