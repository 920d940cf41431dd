package com.nosota.scholarship.api.model;

public enum CourseLevel {
    DIPLOMA,
    UNDERGRADUATE,
    POSTGRADUATE,
    DOCTORAL
}
