package org.dxworks.cobolscope.ast;

import org.dxworks.cobolscope.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AstReaderTest {

    private final AstReader reader = new AstReader();

    @Test
    void readsSampleProgram() {
        AstNode program = TestUtils.sample("payroll.json");

        assertEquals(NodeType.PROGRAM, program.getType());
        assertEquals("PAYROLL", program.name());
        assertEquals(60, program.getEndLine());
        assertEquals(6, program.intAttribute("comment_lines"));
        assertEquals(4, program.getChildren().size());
    }

    @Test
    void decodesStatementVerbsOnce() {
        AstNode program = TestUtils.sample("payroll.json");

        AstNode main = program.getChildren().get(3).getChildren().get(0);
        assertEquals("MAIN-PARA", main.name());
        assertEquals(StatementKind.PERFORM, main.getChildren().get(0).getStatementKind());
        assertEquals(StatementKind.STOP_RUN, main.getChildren().get(4).getStatementKind());
        assertNull(main.getStatementKind());
    }

    @Test
    void acceptsAlternativeSpellings() {
        AstNode node = reader.read("""
                {"node_type": "DataItem", "name": "WS-A", "source_line": 7,
                 "attributes": {"level": "05"}}
                """);

        assertEquals(NodeType.DATA_ITEM, node.getType());
        assertEquals("WS-A", node.name());
        assertEquals(7, node.getLine());
        assertEquals(5, node.intAttribute("level"));
    }

    @Test
    void mapsVerbSynonyms() {
        AstNode node = reader.read("""
                {"type": "statement", "statement_type": "GO TO", "attributes": {"targets": ["P1", "P2"]}}
                """);

        assertEquals(StatementKind.GO_TO, node.getStatementKind());
        assertEquals(List.of("P1", "P2"), node.listAttribute("targets"));
        assertEquals(StatementKind.OTHER, reader.read("""
                {"type": "statement", "attributes": {"statement_type": "XML PARSE"}}
                """).getStatementKind());
    }

    @Test
    void combinedPerformTagsDecodeToPerform() {
        AstNode until = reader.read("""
                {"type": "statement", "statement_type": "PERFORM UNTIL", "attributes": {"target": "WORK"}}
                """);
        assertEquals(StatementKind.PERFORM, until.getStatementKind());
        assertEquals("until", until.text(AstNode.PERFORM_TYPE));

        AstNode varying = reader.read("""
                {"type": "statement", "attributes": {"statement_type": "perform-varying"}}
                """);
        assertEquals(StatementKind.PERFORM, varying.getStatementKind());
        assertEquals("varying", varying.text(AstNode.PERFORM_TYPE));

        AstNode explicit = reader.read("""
                {"type": "statement", "statement_type": "PERFORM THROUGH",
                 "attributes": {"perform_type": "inline"}}
                """);
        assertEquals(StatementKind.PERFORM, explicit.getStatementKind());
        assertEquals("inline", explicit.text(AstNode.PERFORM_TYPE));

        assertEquals(StatementKind.OTHER, reader.read("""
                {"type": "statement", "statement_type": "PERFORM SOMETHING"}
                """).getStatementKind());
    }

    @Test
    void missingOptionalFieldsDefault() {
        AstNode node = reader.read("{\"type\": \"paragraph\"}");

        assertEquals("", node.getValue());
        assertEquals(0, node.getLine());
        assertEquals(0, node.getColumn());
        assertEquals(0, node.getEndLine());
        assertTrue(node.getChildren().isEmpty());
        assertTrue(node.getAttributes().isEmpty());
    }

    @Test
    void stripsByteOrderMark() {
        AstNode node = reader.read("\uFEFF{\"type\": \"program\", \"value\": \"BOM\"}");

        assertEquals("BOM", node.name());
    }

    @Test
    void rejectsUnknownNodeType() {
        assertThrows(AstReadException.class, () -> reader.read("{\"type\": \"macro\"}"));
    }

    @Test
    void rejectsMalformedJson() {
        assertThrows(AstReadException.class, () -> reader.read("{\"type\": "));
        assertThrows(AstReadException.class, () -> reader.read("[1, 2]"));
    }

    @Test
    void readsTreesDeeperThanTheDefaultJsonNestingLimit() {
        int depth = 3_000;
        StringBuilder json = new StringBuilder("{\"type\": \"program\", \"value\": \"DEEP\", \"children\": [");
        for (int i = 0; i < depth; i++) {
            json.append("{\"type\": \"statement\", \"statement_type\": \"IF\", \"children\": [");
        }
        json.append("]}".repeat(depth)).append("]}");

        AstNode node = reader.read(json.toString());

        int levels = 0;
        while (!node.getChildren().isEmpty()) {
            node = node.getChildren().get(0);
            levels++;
        }
        assertEquals(depth, levels);
        assertEquals(StatementKind.IF, node.getStatementKind());
    }

    @Test
    void nodesAreImmutable() {
        AstNode program = TestUtils.sample("payroll.json");

        assertThrows(UnsupportedOperationException.class, () -> program.getChildren().clear());
        assertThrows(UnsupportedOperationException.class, () -> program.getAttributes().put("x", 1));
    }
}
