package com.nosota.scholarship.api.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * @param accountNumber Student bank account number
 * @param ifsc          Bank routing (IFSC) code, e.g. "SBIN0001234"
 */
public record BankDetailsRequest(
        @NotBlank(message = "Account number is required")
        @Size(max = 20)
        String accountNumber,

        @NotBlank(message = "IFSC code is required")
        @Pattern(regexp = "^[A-Z]{4}0[A-Z0-9]{6}$", message = "IFSC code must look like ABCD0123456")
        String ifsc
) {
}
