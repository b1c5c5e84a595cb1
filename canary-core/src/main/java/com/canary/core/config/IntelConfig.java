package com.canary.core.config;

import com.canary.core.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonMerge;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Every tunable of the intelligence engine.
 * Bundled defaults live in canary-defaults.yaml; user overrides in ~/.canary/intel-config.yaml
 * (or the file named by -Dcanary.config) are merged on top, section by section.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IntelConfig {

    private static final Logger log = LoggerFactory.getLogger(IntelConfig.class);

    private static final String DEFAULTS_RESOURCE = "canary-defaults.yaml";
    private static final Path USER_CONFIG_PATH = Path.of(
        System.getProperty("user.home"), ".canary", "intel-config.yaml"
    );
    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    @JsonMerge
    private StorageSettings storage = new StorageSettings();
    @JsonMerge
    private LearningSettings learning = new LearningSettings();
    @JsonMerge
    private PatternSettings patterns = new PatternSettings();
    @JsonMerge
    private KeywordSettings keywords = new KeywordSettings();
    @JsonMerge
    private SourceSettings sources = new SourceSettings();
    @JsonMerge
    private PredictionSettings prediction = new PredictionSettings();

    public IntelConfig() {
        // Default constructor for YAML
    }

    // ==================== Loading ====================

    /**
     * Bundled defaults only.
     */
    public static IntelConfig defaults() {
        try (InputStream in = IntelConfig.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing bundled " + DEFAULTS_RESOURCE);
            }
            return YAML.readValue(in, IntelConfig.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled " + DEFAULTS_RESOURCE, e);
        }
    }

    /**
     * Defaults merged with the user config file, if there is one.
     */
    public static IntelConfig load() {
        String override = System.getProperty("canary.config");
        return load(override != null ? Path.of(override) : USER_CONFIG_PATH);
    }

    /**
     * Defaults merged with the given override file. A missing file means defaults.
     */
    public static IntelConfig load(Path userConfig) {
        IntelConfig config = defaults();
        if (userConfig != null && Files.exists(userConfig)) {
            try {
                YAML.readerForUpdating(config).readValue(userConfig.toFile());
                log.info("Loaded user config from {}", userConfig);
            } catch (IOException e) {
                throw new ValidationException("config", "Cannot parse " + userConfig + ": " + e.getMessage());
            }
        }
        config.validate();
        return config;
    }

    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        YAML.writeValue(path.toFile(), this);
    }

    /**
     * Reject combinations that would break the scoring invariants.
     */
    public void validate() {
        require(prediction.getPatternWeight() >= 0 && prediction.getKeywordWeight() >= 0,
            "prediction.patternWeight", "signal weights must be non-negative");
        require(prediction.getPatternWeight() + prediction.getKeywordWeight() <= 1.0,
            "prediction.keywordWeight", "patternWeight + keywordWeight must not exceed 1");
        require(prediction.getTrustFloor() > 0 && prediction.getTrustFloor() <= prediction.getTrustCeiling(),
            "prediction.trustFloor", "trustFloor must be in (0, trustCeiling]");
        require(prediction.getNeutralScore() >= 0 && prediction.getNeutralScore() <= 10,
            "prediction.neutralScore", "neutralScore must be within 0-10");
        require(prediction.getMaxEconomicAdjustment() >= 0,
            "prediction.maxEconomicAdjustment", "must be non-negative");

        require(learning.getArticleWeightMultiplier() > 0 && learning.getDigestWeightMultiplier() > 0
                && learning.getIrrelevantWeightMultiplier() > 0,
            "learning", "weight multipliers must be positive");
        require(learning.getIrrelevantTargetUrgency() >= 0 && learning.getIrrelevantTargetUrgency() <= 10,
            "learning.irrelevantTargetUrgency", "must be within 0-10");
        require(learning.getOutcomeMatchWindowHours() > 0,
            "learning.outcomeMatchWindowHours", "must be positive");

        require(patterns.getConfidenceCeiling() > 0 && patterns.getConfidenceCeiling() <= 1,
            "patterns.confidenceCeiling", "must be in (0, 1]");
        require(patterns.getConfidenceFloor() >= 0 && patterns.getConfidenceFloor() < patterns.getConfidenceCeiling(),
            "patterns.confidenceFloor", "must be in [0, confidenceCeiling)");
        require(patterns.getDecayMultiplier() > 0 && patterns.getDecayMultiplier() <= 1,
            "patterns.decayMultiplier", "must be in (0, 1]");
        require(patterns.getConfidenceHalfSaturation() > 0,
            "patterns.confidenceHalfSaturation", "must be positive");
        require(patterns.getNearMatchPenalty() >= 0 && patterns.getNearMatchPenalty() <= 1,
            "patterns.nearMatchPenalty", "must be in [0, 1]");

        require(keywords.getLearningRate() > 0 && keywords.getLearningRate() * learning.getArticleWeightMultiplier() <= 1,
            "keywords.learningRate", "learningRate * articleWeightMultiplier must be in (0, 1]");
        require(keywords.getPriorWeight() >= 0 && keywords.getPriorWeight() <= 10,
            "keywords.priorWeight", "must be within 0-10");
        require(keywords.getConfidenceHalfSaturation() > 0,
            "keywords.confidenceHalfSaturation", "must be positive");

        require(sources.getLearningRate() > 0 && sources.getLearningRate() * learning.getArticleWeightMultiplier() <= 1,
            "sources.learningRate", "learningRate * articleWeightMultiplier must be in (0, 1]");
        require(sources.getFloor() >= 0 && sources.getFloor() <= 0.5,
            "sources.floor", "must be in [0, 0.5]");
        require(sources.getDecayRatePerDay() >= 0,
            "sources.decayRatePerDay", "must be non-negative");
    }

    private static void require(boolean condition, String field, String message) {
        if (!condition) {
            throw new ValidationException(field, "Invalid config " + field + ": " + message);
        }
    }

    // ==================== Sections ====================

    public StorageSettings getStorage() {
        return storage;
    }

    public void setStorage(StorageSettings storage) {
        this.storage = storage;
    }

    public LearningSettings getLearning() {
        return learning;
    }

    public void setLearning(LearningSettings learning) {
        this.learning = learning;
    }

    public PatternSettings getPatterns() {
        return patterns;
    }

    public void setPatterns(PatternSettings patterns) {
        this.patterns = patterns;
    }

    public KeywordSettings getKeywords() {
        return keywords;
    }

    public void setKeywords(KeywordSettings keywords) {
        this.keywords = keywords;
    }

    public SourceSettings getSources() {
        return sources;
    }

    public void setSources(SourceSettings sources) {
        this.sources = sources;
    }

    public PredictionSettings getPrediction() {
        return prediction;
    }

    public void setPrediction(PredictionSettings prediction) {
        this.prediction = prediction;
    }
}
