package com.nosota.scholarship.api.model;

public enum Priority {
    LOW,
    MEDIUM,
    HIGH,
    URGENT
}
