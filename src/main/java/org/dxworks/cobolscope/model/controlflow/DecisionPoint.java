package org.dxworks.cobolscope.model.controlflow;

public class DecisionPoint {
    public String kind; // IF, PERFORM_UNTIL, PERFORM_VARYING, WHEN
    public String paragraph;
    public int nestingLevel;
    public int line;
}
