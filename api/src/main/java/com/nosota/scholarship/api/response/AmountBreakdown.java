package com.nosota.scholarship.api.response;

import java.math.BigDecimal;

/**
 * Split of a final amount into components. tuition + maintenance + books == total, to the cent.
 */
public record AmountBreakdown(
        BigDecimal tuition,
        BigDecimal maintenance,
        BigDecimal books,
        BigDecimal total
) {
}
