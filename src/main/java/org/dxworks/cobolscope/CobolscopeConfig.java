package org.dxworks.cobolscope;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.cobolscope.analyzer.HalsteadLogMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Engine and runner settings. Every threshold the analyzers compare against lives here.
 */
public class CobolscopeConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(CobolscopeConfig.class);

    private static final String CONFIG_FILE_NAME = "cobolscope-config.yml";

    public static final int DEFAULT_CRITICAL_ITEM_THRESHOLD = 5;
    public static final double DEFAULT_RECOMMENDATION_CUTOFF = 0.7;
    public static final double DEFAULT_WARNING_TOLERANCE = 0.2;
    public static final double DEFAULT_EXCELLENT_SCORE = 0.9;
    public static final double DEFAULT_GOOD_SCORE = 0.75;
    public static final int DEFAULT_CYCLOMATIC_HOTSPOT_THRESHOLD = 10;
    public static final int DEFAULT_COGNITIVE_HOTSPOT_THRESHOLD = 15;
    public static final double DEFAULT_LOW_COMMENT_RATIO = 0.1;

    private final int criticalItemThreshold;
    private final double recommendationCutoff;
    private final double warningTolerance;
    private final double excellentScore;
    private final double goodScore;
    private final int cyclomaticHotspotThreshold;
    private final int cognitiveHotspotThreshold;
    private final double lowCommentRatio;
    private final HalsteadLogMode halsteadLogMode;
    private final int workerThreads;
    private final long timeoutSeconds;
    private final String benchmarksFile;

    private CobolscopeConfig(int criticalItemThreshold, double recommendationCutoff, double warningTolerance,
                             double excellentScore, double goodScore, int cyclomaticHotspotThreshold,
                             int cognitiveHotspotThreshold, double lowCommentRatio, HalsteadLogMode halsteadLogMode,
                             int workerThreads, long timeoutSeconds, String benchmarksFile) {
        this.criticalItemThreshold = criticalItemThreshold;
        this.recommendationCutoff = recommendationCutoff;
        this.warningTolerance = warningTolerance;
        this.excellentScore = excellentScore;
        this.goodScore = goodScore;
        this.cyclomaticHotspotThreshold = cyclomaticHotspotThreshold;
        this.cognitiveHotspotThreshold = cognitiveHotspotThreshold;
        this.lowCommentRatio = lowCommentRatio;
        this.halsteadLogMode = halsteadLogMode;
        this.workerThreads = workerThreads;
        this.timeoutSeconds = timeoutSeconds;
        this.benchmarksFile = benchmarksFile;
    }

    public static CobolscopeConfig defaults() {
        return new CobolscopeConfig(DEFAULT_CRITICAL_ITEM_THRESHOLD, DEFAULT_RECOMMENDATION_CUTOFF,
                DEFAULT_WARNING_TOLERANCE, DEFAULT_EXCELLENT_SCORE, DEFAULT_GOOD_SCORE,
                DEFAULT_CYCLOMATIC_HOTSPOT_THRESHOLD, DEFAULT_COGNITIVE_HOTSPOT_THRESHOLD,
                DEFAULT_LOW_COMMENT_RATIO, HalsteadLogMode.LOG2, defaultWorkerThreads(), 0L, null);
    }

    public static CobolscopeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static CobolscopeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                return fromYaml(yamlConfig);
            }
        } catch (IOException | IllegalArgumentException e) {
            LOGGER.warn("Ignoring unreadable config {}: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    private static CobolscopeConfig fromYaml(YamlConfig yaml) {
        CobolscopeConfig d = defaults();
        return new CobolscopeConfig(
                nonNegative(yaml.criticalItemThreshold, d.criticalItemThreshold),
                fraction(yaml.recommendationCutoff, d.recommendationCutoff),
                yaml.warningTolerance != null && yaml.warningTolerance >= 0 ? yaml.warningTolerance : d.warningTolerance,
                fraction(yaml.excellentScore, d.excellentScore),
                fraction(yaml.goodScore, d.goodScore),
                positive(yaml.cyclomaticHotspotThreshold, d.cyclomaticHotspotThreshold),
                positive(yaml.cognitiveHotspotThreshold, d.cognitiveHotspotThreshold),
                fraction(yaml.lowCommentRatio, d.lowCommentRatio),
                yaml.halsteadLogMode != null ? HalsteadLogMode.fromName(yaml.halsteadLogMode) : d.halsteadLogMode,
                positive(yaml.workerThreads, d.workerThreads),
                yaml.timeoutSeconds != null && yaml.timeoutSeconds >= 0 ? yaml.timeoutSeconds : d.timeoutSeconds,
                yaml.benchmarksFile);
    }

    private static int positive(Integer value, int fallback) {
        return value != null && value > 0 ? value : fallback;
    }

    private static int nonNegative(Integer value, int fallback) {
        return value != null && value >= 0 ? value : fallback;
    }

    private static double fraction(Double value, double fallback) {
        return value != null && value >= 0.0 && value <= 1.0 ? value : fallback;
    }

    private static int defaultWorkerThreads() {
        return Math.max(1, Runtime.getRuntime().availableProcessors());
    }

    public int getCriticalItemThreshold() {
        return criticalItemThreshold;
    }

    public double getRecommendationCutoff() {
        return recommendationCutoff;
    }

    public double getWarningTolerance() {
        return warningTolerance;
    }

    public double getExcellentScore() {
        return excellentScore;
    }

    public double getGoodScore() {
        return goodScore;
    }

    public int getCyclomaticHotspotThreshold() {
        return cyclomaticHotspotThreshold;
    }

    public int getCognitiveHotspotThreshold() {
        return cognitiveHotspotThreshold;
    }

    public double getLowCommentRatio() {
        return lowCommentRatio;
    }

    public HalsteadLogMode getHalsteadLogMode() {
        return halsteadLogMode;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public String getBenchmarksFile() {
        return benchmarksFile;
    }

    public CobolscopeConfig withCriticalItemThreshold(int threshold) {
        return new CobolscopeConfig(threshold, recommendationCutoff, warningTolerance, excellentScore, goodScore,
                cyclomaticHotspotThreshold, cognitiveHotspotThreshold, lowCommentRatio, halsteadLogMode,
                workerThreads, timeoutSeconds, benchmarksFile);
    }

    public CobolscopeConfig withRecommendationCutoff(double cutoff) {
        return new CobolscopeConfig(criticalItemThreshold, cutoff, warningTolerance, excellentScore, goodScore,
                cyclomaticHotspotThreshold, cognitiveHotspotThreshold, lowCommentRatio, halsteadLogMode,
                workerThreads, timeoutSeconds, benchmarksFile);
    }

    public CobolscopeConfig withWarningTolerance(double tolerance) {
        return new CobolscopeConfig(criticalItemThreshold, recommendationCutoff, tolerance, excellentScore, goodScore,
                cyclomaticHotspotThreshold, cognitiveHotspotThreshold, lowCommentRatio, halsteadLogMode,
                workerThreads, timeoutSeconds, benchmarksFile);
    }

    public CobolscopeConfig withHalsteadLogMode(HalsteadLogMode mode) {
        return new CobolscopeConfig(criticalItemThreshold, recommendationCutoff, warningTolerance, excellentScore,
                goodScore, cyclomaticHotspotThreshold, cognitiveHotspotThreshold, lowCommentRatio, mode,
                workerThreads, timeoutSeconds, benchmarksFile);
    }

    public CobolscopeConfig withWorkers(int threads, long timeout) {
        return new CobolscopeConfig(criticalItemThreshold, recommendationCutoff, warningTolerance, excellentScore,
                goodScore, cyclomaticHotspotThreshold, cognitiveHotspotThreshold, lowCommentRatio, halsteadLogMode,
                Math.max(1, threads), Math.max(0L, timeout), benchmarksFile);
    }

    private static class YamlConfig {
        public Integer criticalItemThreshold;
        public Double recommendationCutoff;
        public Double warningTolerance;
        public Double excellentScore;
        public Double goodScore;
        public Integer cyclomaticHotspotThreshold;
        public Integer cognitiveHotspotThreshold;
        public Double lowCommentRatio;
        public String halsteadLogMode;
        public Integer workerThreads;
        public Long timeoutSeconds;
        public String benchmarksFile;
    }
}
