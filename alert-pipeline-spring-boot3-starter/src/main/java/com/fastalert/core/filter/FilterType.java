package com.fastalert.core.filter;

public enum FilterType {
    SEVERITY,
    SOURCE,
    SAMPLING,
    CONTENT,
    TIME_WINDOW,
    COMPOSITE,
    CUSTOM
}
