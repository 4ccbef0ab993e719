package com.logsentinel.core.lifecycle;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The {@code metadata.json} descriptor shipped in every bundle.
 *
 * <pre>
 * {
 *   "modelInfo": {"version": "1.2", "modelType": "logistic_regression", "createdAt": "..."},
 *   "trainingInfo": {"featureNames": [...], "sampleCount": 5000},
 *   "evaluationInfo": {"basicMetrics": {"f1Score": 0.8, "rocAuc": 0.9, "precision": 0.8, "recall": 0.7}}
 * }
 * </pre>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelMetadata {

    private ModelInfo modelInfo;
    private TrainingInfo trainingInfo;
    private EvaluationInfo evaluationInfo;

    public ModelInfo getModelInfo() {
        return modelInfo;
    }

    public void setModelInfo(ModelInfo modelInfo) {
        this.modelInfo = modelInfo;
    }

    public TrainingInfo getTrainingInfo() {
        return trainingInfo;
    }

    public void setTrainingInfo(TrainingInfo trainingInfo) {
        this.trainingInfo = trainingInfo;
    }

    public EvaluationInfo getEvaluationInfo() {
        return evaluationInfo;
    }

    public void setEvaluationInfo(EvaluationInfo evaluationInfo) {
        this.evaluationInfo = evaluationInfo;
    }

    /**
     * @return the basic metrics block, if present
     */
    @JsonIgnore
    public Optional<BasicMetrics> basicMetrics() {
        return Optional.ofNullable(evaluationInfo).map(EvaluationInfo::getBasicMetrics);
    }

    /**
     * @return metric name to value for every metric that is set
     */
    @JsonIgnore
    public Map<String, Double> metricsSnapshot() {
        Map<String, Double> snapshot = new LinkedHashMap<>();
        basicMetrics().ifPresent(m -> {
            putIfSet(snapshot, "f1Score", m.getF1Score());
            putIfSet(snapshot, "rocAuc", m.getRocAuc());
            putIfSet(snapshot, "precision", m.getPrecision());
            putIfSet(snapshot, "recall", m.getRecall());
        });
        return snapshot;
    }

    private static void putIfSet(Map<String, Double> map, String key, Double value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    // ---------------------------------------------------------------
    // Nested sections
    // ---------------------------------------------------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ModelInfo {

        /** ISO date with optional time and optional offset. */
        private static final DateTimeFormatter CREATED_AT_FORMAT = new DateTimeFormatterBuilder()
                .append(DateTimeFormatter.ISO_LOCAL_DATE)
                .optionalStart()
                .appendLiteral('T')
                .append(DateTimeFormatter.ISO_LOCAL_TIME)
                .optionalStart()
                .appendOffsetId()
                .optionalEnd()
                .optionalEnd()
                .toFormatter();

        private String version;
        private String modelType;
        private String createdAt;

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public String getModelType() {
            return modelType;
        }

        public void setModelType(String modelType) {
            this.modelType = modelType;
        }

        public String getCreatedAt() {
            return createdAt;
        }

        public void setCreatedAt(String createdAt) {
            this.createdAt = createdAt;
        }

        /**
         * Parse {@code createdAt} as an ISO date-time with offset, a local
         * date-time (UTC) or a date.
         *
         * @return the creation time, or empty if absent or unparseable
         */
        @JsonIgnore
        public Optional<Instant> createdAtInstant() {
            if (createdAt == null || createdAt.isBlank()) {
                return Optional.empty();
            }
            String s = createdAt.trim().replace(' ', 'T');
            try {
                TemporalAccessor parsed = CREATED_AT_FORMAT.parseBest(s, Instant::from, LocalDateTime::from,
                        LocalDate::from);
                if (parsed instanceof Instant instant) {
                    return Optional.of(instant);
                }
                if (parsed instanceof LocalDateTime local) {
                    return Optional.of(local.toInstant(ZoneOffset.UTC));
                }
                return Optional.of(((LocalDate) parsed).atStartOfDay().toInstant(ZoneOffset.UTC));
            } catch (DateTimeParseException e) {
                return Optional.empty();
            }
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TrainingInfo {
        private List<String> featureNames;
        private Long sampleCount;

        public List<String> getFeatureNames() {
            return featureNames;
        }

        public void setFeatureNames(List<String> featureNames) {
            this.featureNames = featureNames != null ? new ArrayList<>(featureNames) : null;
        }

        public Long getSampleCount() {
            return sampleCount;
        }

        public void setSampleCount(Long sampleCount) {
            this.sampleCount = sampleCount;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EvaluationInfo {
        private BasicMetrics basicMetrics;

        public BasicMetrics getBasicMetrics() {
            return basicMetrics;
        }

        public void setBasicMetrics(BasicMetrics basicMetrics) {
            this.basicMetrics = basicMetrics;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BasicMetrics {
        private Double f1Score;
        private Double rocAuc;
        private Double precision;
        private Double recall;

        public Double getF1Score() {
            return f1Score;
        }

        public void setF1Score(Double f1Score) {
            this.f1Score = f1Score;
        }

        public Double getRocAuc() {
            return rocAuc;
        }

        public void setRocAuc(Double rocAuc) {
            this.rocAuc = rocAuc;
        }

        public Double getPrecision() {
            return precision;
        }

        public void setPrecision(Double precision) {
            this.precision = precision;
        }

        public Double getRecall() {
            return recall;
        }

        public void setRecall(Double recall) {
            this.recall = recall;
        }
    }
}
