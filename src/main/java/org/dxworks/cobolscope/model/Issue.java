package org.dxworks.cobolscope.model;

import java.util.LinkedHashMap;
import java.util.Map;

public class Issue {
    public IssueKind kind;
    public Severity severity;
    public String analyzer;
    public String message;
    public String location; // paragraph, data item or division the issue points at; nullable
    public int line;
    public Map<String, Object> details = new LinkedHashMap<>();

    public Issue() {
    }

    public Issue(IssueKind kind, Severity severity, String analyzer, String message) {
        this.kind = kind;
        this.severity = severity;
        this.analyzer = analyzer;
        this.message = message;
    }

    public Issue at(String location, int line) {
        this.location = location;
        this.line = line;
        return this;
    }

    public Issue detail(String key, Object value) {
        if (value != null) {
            details.put(key, value);
        }
        return this;
    }

    @Override
    public String toString() {
        return kind + "/" + severity + ": " + message;
    }
}
