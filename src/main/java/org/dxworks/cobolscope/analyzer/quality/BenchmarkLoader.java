package org.dxworks.cobolscope.analyzer.quality;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.cobolscope.model.quality.MetricCategory;
import org.dxworks.cobolscope.model.quality.QualityMetricDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads benchmark criteria from YAML:
 * <pre>
 * metrics:
 *   - name: cyclomatic_complexity
 *     category: complexity
 *     min: 1
 *     max: 50
 *     target: 10
 *     weight: 1.0
 * </pre>
 * Entries without a name or with an unknown category are skipped with a warning.
 */
public final class BenchmarkLoader {

    public static final String DEFAULT_RESOURCE = "default-benchmarks.yml";

    private static final Logger LOGGER = LoggerFactory.getLogger(BenchmarkLoader.class);

    private BenchmarkLoader() {
    }

    public static List<QualityMetricDefinition> loadDefault() {
        try (InputStream in = BenchmarkLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            }
            return read(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read " + DEFAULT_RESOURCE, e);
        }
    }

    public static List<QualityMetricDefinition> load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public static List<QualityMetricDefinition> read(InputStream in) throws IOException {
        ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        BenchmarkFile file = yamlMapper.readValue(in, BenchmarkFile.class);
        List<QualityMetricDefinition> definitions = new ArrayList<>();
        if (file == null || file.metrics == null) {
            return definitions;
        }
        for (BenchmarkEntry entry : file.metrics) {
            QualityMetricDefinition definition = toDefinition(entry);
            if (definition != null) {
                definitions.add(definition);
            }
        }
        return definitions;
    }

    private static QualityMetricDefinition toDefinition(BenchmarkEntry entry) {
        if (entry == null || entry.name == null || entry.name.isBlank()) {
            LOGGER.warn("Skipping benchmark entry without a metric name");
            return null;
        }
        MetricCategory category;
        try {
            category = MetricCategory.fromName(entry.category == null ? "" : entry.category);
        } catch (IllegalArgumentException e) {
            LOGGER.warn("Skipping benchmark {}: unknown category '{}'", entry.name, entry.category);
            return null;
        }
        if (entry.min != null && entry.max != null && entry.min > entry.max) {
            LOGGER.warn("Skipping benchmark {}: min {} is above max {}", entry.name, entry.min, entry.max);
            return null;
        }
        double weight = entry.weight != null && entry.weight > 0 ? entry.weight : 1.0;
        QualityMetricDefinition definition = new QualityMetricDefinition(entry.name.trim(), category,
                entry.min, entry.max, entry.target, weight);
        definition.description = entry.description;
        return definition;
    }

    private static class BenchmarkFile {
        public List<BenchmarkEntry> metrics;
    }

    private static class BenchmarkEntry {
        public String name;
        public String category;
        public Double min;
        public Double max;
        public Double target;
        public Double weight;
        public String description;
    }
}
