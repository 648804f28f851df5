package org.dxworks.cobolscope.analyzer.quality;

import org.dxworks.cobolscope.model.quality.EvaluationLevel;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SuggestionCatalogTest {

    @Test
    void defaultCatalogCoversTheMainMetrics() {
        SuggestionCatalog catalog = SuggestionCatalog.loadDefault();

        assertTrue(catalog.covers("cyclomatic_complexity"));
        assertTrue(catalog.covers("maintainability_index"));
        assertTrue(catalog.covers("halstead_complexity"));
        assertTrue(catalog.covers("data_complexity"));
        assertFalse(catalog.covers("goto_count"));
    }

    @Test
    void goodAndExcellentUseTheAcceptableTemplate() {
        SuggestionCatalog catalog = new SuggestionCatalog(null, Map.of("m", Map.of(
                "critical", "fix {metric} now",
                "acceptable", "{metric} is {actual}, aim for {target}")));

        assertEquals("fix m now", catalog.suggestion("m", EvaluationLevel.CRITICAL, 1, 2));
        assertEquals("m is 1.50, aim for 2.00", catalog.suggestion("m", EvaluationLevel.GOOD, 1.5, 2));
        assertEquals("m is 3.00, aim for 2.00", catalog.suggestion("m", EvaluationLevel.EXCELLENT, 3, 2));
    }

    @Test
    void missingTemplateFallsBackToGeneric() {
        SuggestionCatalog catalog = new SuggestionCatalog(null, Map.of("m", Map.of("critical", "fix it")));

        String suggestion = catalog.suggestion("m", EvaluationLevel.WARNING, 4, 2);

        assertEquals("No specific guidance is available for m. Follow the general coding standards.", suggestion);
    }

    @Test
    void loadsCustomCatalog() throws IOException {
        String yaml = "generic: \"Look at {metric}\"\n"
                + "metrics:\n"
                + "  goto_count:\n"
                + "    warning: |-\n"
                + "      Replace GO TO with PERFORM\n"
                + "      Current: {actual}\n";

        SuggestionCatalog catalog = SuggestionCatalog.load(
                new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertEquals("Replace GO TO with PERFORM\nCurrent: 7.00",
                catalog.suggestion("goto_count", EvaluationLevel.WARNING, 7, 0));
        assertEquals("Look at lines_of_code", catalog.suggestion("lines_of_code", EvaluationLevel.CRITICAL, 1, 0));
    }
}
