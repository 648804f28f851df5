package org.dxworks.cobolscope;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.cobolscope.analyzer.AnalysisEngine;
import org.dxworks.cobolscope.analyzer.quality.BenchmarkLoader;
import org.dxworks.cobolscope.analyzer.quality.SuggestionCatalog;
import org.dxworks.cobolscope.ast.AstReader;
import org.dxworks.cobolscope.batch.AstSource;
import org.dxworks.cobolscope.batch.BatchAnalyzer;
import org.dxworks.cobolscope.batch.BatchResult;
import org.dxworks.cobolscope.batch.OutcomeStatus;
import org.dxworks.cobolscope.batch.SourceOutcome;
import org.dxworks.cobolscope.model.quality.QualityMetricDefinition;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar cobolscope.jar <input> <output-file> [benchmarks.yml]");
            System.err.println("  <input>:          AST JSON file or directory of *.json AST files");
            System.err.println("  <output-file>:    Path to output JSONL file");
            System.err.println("  [benchmarks.yml]: Benchmark criteria (defaults to the bundled set)");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        CobolscopeConfig config = CobolscopeConfig.load();
        String benchmarksFile = args.length > 2 ? args[2] : config.getBenchmarksFile();
        List<QualityMetricDefinition> benchmarks = benchmarksFile != null
                ? BenchmarkLoader.load(Paths.get(benchmarksFile))
                : BenchmarkLoader.loadDefault();

        System.out.println("Starting COBOL AST analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        List<Path> files = collectAstFiles(input);
        System.out.println("Found " + files.size() + " AST files");

        AstReader reader = new AstReader();
        List<AstSource> sources = new ArrayList<>();
        for (Path file : files) {
            sources.add(AstSource.file(file, reader));
        }

        AnalysisEngine engine = AnalysisEngine.create(SuggestionCatalog.loadDefault());
        BatchAnalyzer batchAnalyzer = new BatchAnalyzer(engine, config, benchmarks);

        Instant startTime = Instant.now();
        AtomicInteger progressCounter = new AtomicInteger(0);
        BatchResult batch;

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new LinkedHashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            runInfo.put("benchmarks", benchmarks.size());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            batch = batchAnalyzer.analyze(sources, outcome -> {
                int current = progressCounter.incrementAndGet();
                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] " + describe(outcome));
                }
                write(writer, record(outcome));
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new LinkedHashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("files_analyzed", batch.succeeded);
            doneInfo.put("files_with_errors", batch.failed);
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully analyzed: " + batch.succeeded + " programs");
        if (batch.failed > 0) {
            System.out.println("Errors: " + batch.failed);
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    private static Object record(SourceOutcome outcome) {
        if (outcome.status == OutcomeStatus.ANALYZED) {
            return outcome.result;
        }
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("kind", "error");
        error.put("file", outcome.sourceId);
        error.put("status", outcome.status.name());
        error.put("error", outcome.error);
        if (outcome.result != null) {
            error.put("errors", outcome.result.errors);
        }
        return error;
    }

    private static String describe(SourceOutcome outcome) {
        String name = Paths.get(outcome.sourceId).getFileName().toString();
        if (outcome.isSuccess()) {
            return "Analyzed " + outcome.result.programId + " (" + name + ")"
                    + (outcome.result.quality != null
                    ? String.format(Locale.ROOT, " score %.2f", outcome.result.quality.overallScore)
                    : "");
        }
        return outcome.status + " " + name + ": " + outcome.error;
    }

    private static void write(BufferedWriter writer, Object record) {
        try {
            synchronized (writer) {
                writer.write(MAPPER.writeValueAsString(record));
                writer.newLine();
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static List<Path> collectAstFiles(Path input) throws IOException {
        List<Path> files = new ArrayList<>();
        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json"))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            files.add(input);
        }
        return files;
    }
}
