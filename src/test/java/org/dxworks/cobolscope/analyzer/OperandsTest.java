package org.dxworks.cobolscope.analyzer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OperandsTest {

    @Test
    void literals() {
        assertTrue(Operands.isLiteral("'ABC'"));
        assertTrue(Operands.isLiteral("\"X\""));
        assertTrue(Operands.isLiteral("-12.5"));
        assertTrue(Operands.isLiteral("zeros"));
        assertTrue(Operands.isLiteral("ALL '*'"));
        assertFalse(Operands.isLiteral("WS-TOTAL"));
        assertFalse(Operands.isLiteral("ALLOWANCE"));
    }

    @Test
    void unquote() {
        assertEquals("PAYCALC", Operands.unquote(" 'PAYCALC' "));
        assertEquals("PAYCALC", Operands.unquote("\"PAYCALC\""));
        assertNull(Operands.unquote("WS-PROG"));
        assertNull(Operands.unquote("'open"));
    }

    @Test
    void dataNameDropsSubscriptsAndQualification() {
        assertEquals("WS-ENTRY", Operands.dataName("WS-ENTRY(WS-IDX)"));
        assertEquals("WS-NAME", Operands.dataName("WS-NAME OF WS-EMPLOYEE"));
        assertEquals("ws-count", Operands.dataName(" ws-count "));
    }

    @Test
    void identifiersSkipLiteralsAndKeywords() {
        assertEquals(List.of("WS-A", "WS-B", "WS-C"),
                Operands.identifiers("WS-A IS GREATER THAN 10 AND WS-B = 'X' OR NOT WS-C"));
        assertEquals(List.of("WS-TOTAL", "WS-RATE"), Operands.identifiers("(WS-TOTAL * WS-RATE) / 100"));
        assertTrue(Operands.identifiers(null).isEmpty());
    }

    @Test
    void tokensKeepOperatorsAndQuotedText() {
        assertEquals(List.of("A", ">=", "'X Y'", "AND", "B", "**", "2"), Operands.tokens("A >= 'X Y' AND B ** 2"));
        assertTrue(Operands.isOperatorSymbol(">="));
        assertFalse(Operands.isOperatorSymbol("'X'"));
        assertTrue(Operands.isConditionWord("greater"));
    }
}
