package org.dxworks.cobolscope.model.data;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum DependencyKind {
    @JsonProperty("redefines") REDEFINES,
    @JsonProperty("occurs-depending") OCCURS_DEPENDING,
    @JsonProperty("value") VALUE,
    @JsonProperty("data-flow") DATA_FLOW
}
