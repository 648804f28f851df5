package org.dxworks.cobolscope.batch;

import org.dxworks.cobolscope.CobolscopeConfig;
import org.dxworks.cobolscope.analyzer.AnalysisContext;
import org.dxworks.cobolscope.analyzer.AnalysisEngine;
import org.dxworks.cobolscope.analyzer.CancellationToken;
import org.dxworks.cobolscope.ast.AstNode;
import org.dxworks.cobolscope.model.quality.QualityMetricDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.Consumer;

/**
 * Analyzes many programs on a fixed worker pool. Each source gets its own cancellation token carrying the
 * configured timeout; one source failing, timing out or being fatal never affects the others.
 */
public class BatchAnalyzer {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchAnalyzer.class);

    private final AnalysisEngine engine;
    private final CobolscopeConfig config;
    private final List<QualityMetricDefinition> benchmarks;

    public BatchAnalyzer(AnalysisEngine engine, CobolscopeConfig config, List<QualityMetricDefinition> benchmarks) {
        this.engine = engine;
        this.config = config;
        this.benchmarks = List.copyOf(benchmarks);
    }

    public BatchResult analyze(List<AstSource> sources) {
        return analyze(sources, outcome -> {
        });
    }

    /**
     * @param listener called on the worker thread as each source finishes, in completion order
     */
    public BatchResult analyze(List<AstSource> sources, Consumer<SourceOutcome> listener) {
        int threads = Math.max(1, Math.min(config.getWorkerThreads(), sources.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<SourceOutcome>> futures = new ArrayList<>(sources.size());
            for (AstSource source : sources) {
                futures.add(pool.submit(() -> {
                    SourceOutcome outcome = analyzeOne(source);
                    listener.accept(outcome);
                    return outcome;
                }));
            }

            BatchResult batch = new BatchResult();
            for (int i = 0; i < futures.size(); i++) {
                SourceOutcome outcome = await(sources.get(i), futures.get(i));
                batch.outcomes.add(outcome);
                if (outcome.isSuccess()) {
                    batch.succeeded++;
                } else {
                    batch.failed++;
                }
            }
            return batch;
        } finally {
            pool.shutdownNow();
        }
    }

    private SourceOutcome analyzeOne(AstSource source) {
        CancellationToken token = CancellationToken.withTimeout(Duration.ofSeconds(config.getTimeoutSeconds()));
        try {
            AstNode program = source.load();
            AnalysisContext context = AnalysisContext.of(config, benchmarks, token);
            return SourceOutcome.of(source.id(), engine.analyze(source.id(), program, context));
        } catch (Exception e) {
            LOGGER.warn("Could not analyze {}: {}", source.id(), e.getMessage());
            return SourceOutcome.failed(source.id(), e.getMessage() == null ? e.toString() : e.getMessage());
        }
    }

    private static SourceOutcome await(AstSource source, Future<SourceOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SourceOutcome.failed(source.id(), "Interrupted");
        } catch (ExecutionException e) {
            LOGGER.warn("Worker for {} failed", source.id(), e.getCause());
            return SourceOutcome.failed(source.id(), String.valueOf(e.getCause()));
        }
    }
}
