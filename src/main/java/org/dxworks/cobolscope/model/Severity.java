package org.dxworks.cobolscope.model;

public enum Severity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
