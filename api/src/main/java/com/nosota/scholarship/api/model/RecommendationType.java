package com.nosota.scholarship.api.model;

public enum RecommendationType {
    WARNING,
    INFO,
    SUCCESS
}
