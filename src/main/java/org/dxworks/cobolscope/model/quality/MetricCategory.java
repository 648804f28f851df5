package org.dxworks.cobolscope.model.quality;

import com.fasterxml.jackson.annotation.JsonCreator;

import java.util.Locale;

public enum MetricCategory {
    COMPLEXITY,
    MAINTAINABILITY,
    READABILITY,
    TESTABILITY,
    MODULARITY,
    DOCUMENTATION;

    @JsonCreator
    public static MetricCategory fromName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
