package org.dxworks.cobolscope.analyzer.quality;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.cobolscope.model.quality.EvaluationLevel;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Improvement suggestion templates keyed by metric name and severity ({@code critical}, {@code warning},
 * {@code acceptable}). Templates may use {@code {metric}}, {@code {actual}} and {@code {target}}.
 */
public class SuggestionCatalog {

    public static final String DEFAULT_RESOURCE = "suggestions.yml";

    private static final String FALLBACK_GENERIC =
            "No specific guidance is available for {metric}. Follow the general coding standards.";

    private final String generic;
    private final Map<String, Map<String, String>> templates;

    public SuggestionCatalog(String generic, Map<String, Map<String, String>> templates) {
        this.generic = generic == null || generic.isBlank() ? FALLBACK_GENERIC : generic;
        Map<String, Map<String, String>> copy = new LinkedHashMap<>();
        if (templates != null) {
            templates.forEach((metric, bySeverity) -> copy.put(metric,
                    bySeverity == null ? Map.of() : Map.copyOf(bySeverity)));
        }
        this.templates = copy;
    }

    public static SuggestionCatalog loadDefault() {
        try (InputStream in = SuggestionCatalog.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + DEFAULT_RESOURCE, e);
        }
    }

    public static SuggestionCatalog load(InputStream in) throws IOException {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        CatalogFile file = yamlMapper.readValue(in, CatalogFile.class);
        if (file == null) {
            return new SuggestionCatalog(null, Map.of());
        }
        return new SuggestionCatalog(file.generic, file.metrics);
    }

    public boolean covers(String metric) {
        return templates.containsKey(metric);
    }

    public String suggestion(String metric, EvaluationLevel level, double actual, double target) {
        String template = templates.getOrDefault(metric, Map.of()).get(level.severityKey());
        if (template == null) {
            template = generic;
        }
        return template
                .replace("{metric}", metric)
                .replace("{actual}", String.format(Locale.ROOT, "%.2f", actual))
                .replace("{target}", String.format(Locale.ROOT, "%.2f", target))
                .trim();
    }

    private static class CatalogFile {
        public String generic;
        public Map<String, Map<String, String>> metrics;
    }
}
