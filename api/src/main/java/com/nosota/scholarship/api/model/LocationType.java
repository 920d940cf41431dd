package com.nosota.scholarship.api.model;

public enum LocationType {
    URBAN,
    RURAL
}
