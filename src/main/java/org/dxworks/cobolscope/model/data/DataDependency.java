package org.dxworks.cobolscope.model.data;

public class DataDependency {
    public String source;
    public String target;
    public DependencyKind kind;
    public int line;

    public DataDependency() {
    }

    public DataDependency(String source, String target, DependencyKind kind, int line) {
        this.source = source;
        this.target = target;
        this.kind = kind;
        this.line = line;
    }
}
