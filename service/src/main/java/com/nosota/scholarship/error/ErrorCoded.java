package com.nosota.scholarship.error;

/**
 * Exception carrying a machine readable error code for API responses and batch item results.
 */
public interface ErrorCoded {

    String getCode();
}
