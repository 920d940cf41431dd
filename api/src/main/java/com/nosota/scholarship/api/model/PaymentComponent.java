package com.nosota.scholarship.api.model;

/**
 * Part of a disbursement that is paid and tracked separately. Shares follow the
 * calculation breakdown: tuition 70%, maintenance 25%, books the remainder.
 */
public enum PaymentComponent {
    TUITION,
    MAINTENANCE,
    BOOKS
}
