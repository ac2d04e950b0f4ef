package io.teleops.evaluation;

import io.teleops.config.TeleopsProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Grades hypotheses against ground truth and aggregates the grades.
 * <p>
 * A record is correct when its score reaches the correct threshold, and wrong but
 * confident when its score is below the wrong-similarity threshold while its confidence
 * (0 when missing) reaches the wrong-confidence threshold. Values are not rounded.
 */
@Component
public class QualityScorer {

    private final SimilarityFunction similarity;
    private final double correctThreshold;
    private final double wrongSimilarityThreshold;
    private final double wrongConfidenceThreshold;

    @Autowired
    public QualityScorer(SimilarityFunction similarity, TeleopsProperties properties) {
        this(similarity,
                properties.getEvaluation().getCorrectThreshold(),
                properties.getEvaluation().getWrongSimilarityThreshold(),
                properties.getEvaluation().getWrongConfidenceThreshold());
    }

    public QualityScorer(SimilarityFunction similarity, double correctThreshold,
                         double wrongSimilarityThreshold, double wrongConfidenceThreshold) {
        this.similarity = similarity;
        this.correctThreshold = correctThreshold;
        this.wrongSimilarityThreshold = wrongSimilarityThreshold;
        this.wrongConfidenceThreshold = wrongConfidenceThreshold;
    }

    /**
     * Best similarity between any hypothesis and the ground truth, 0.0 without hypotheses.
     */
    public double score(List<String> hypotheses, String groundTruth) {
        if (hypotheses == null || hypotheses.isEmpty()) {
            return 0.0;
        }
        double best = 0.0;
        for (String hypothesis : hypotheses) {
            best = Math.max(best, Math.max(0.0, similarity.similarity(hypothesis, groundTruth)));
        }
        return best;
    }

    /**
     * Aggregate one source's records.
     *
     * @return empty when no record was attempted
     */
    public Optional<QualityMetrics> aggregate(Collection<ScoredIncident> records) {
        if (records == null || records.isEmpty()) {
            return Optional.empty();
        }
        List<ScoredIncident> attempted = records.stream().filter(ScoredIncident::isAttempted).toList();
        if (attempted.isEmpty()) {
            return Optional.empty();
        }

        List<ScoredIncident> correct = attempted.stream()
                .filter(record -> record.getScore() >= correctThreshold)
                .toList();
        List<ScoredIncident> incorrect = attempted.stream()
                .filter(record -> record.getScore() < correctThreshold)
                .toList();
        long wrongButConfident = attempted.stream()
                .filter(record -> record.getScore() < wrongSimilarityThreshold
                        && confidenceOrZero(record) >= wrongConfidenceThreshold)
                .count();

        return Optional.of(QualityMetrics.builder()
                .precision((double) correct.size() / attempted.size())
                .recall((double) correct.size() / records.size())
                .wrongButConfidentRate((double) wrongButConfident / attempted.size())
                .wrongButConfidentCount((int) wrongButConfident)
                .meanConfidenceCorrect(meanConfidence(correct))
                .meanConfidenceIncorrect(meanConfidence(incorrect))
                .totalAttempted(attempted.size())
                .totalCorrect(correct.size())
                .totalConsidered(records.size())
                .build());
    }

    /**
     * Aggregate each source independently, in first-seen source order.
     * A source without attempted records maps to null.
     */
    public Map<String, QualityMetrics> aggregateBySource(Collection<ScoredIncident> records) {
        Map<String, List<ScoredIncident>> bySource = new LinkedHashMap<>();
        if (records != null) {
            for (ScoredIncident record : records) {
                bySource.computeIfAbsent(record.getSource(), source -> new ArrayList<>()).add(record);
            }
        }
        Map<String, QualityMetrics> result = new LinkedHashMap<>();
        bySource.forEach((source, sourceRecords) -> result.put(source, aggregate(sourceRecords).orElse(null)));
        return result;
    }

    public Map<String, Double> thresholds() {
        Map<String, Double> thresholds = new LinkedHashMap<>();
        thresholds.put("correct", correctThreshold);
        thresholds.put("wrong_confident_similarity", wrongSimilarityThreshold);
        thresholds.put("wrong_confident_confidence", wrongConfidenceThreshold);
        return thresholds;
    }

    private static double confidenceOrZero(ScoredIncident record) {
        return record.getConfidence() != null ? record.getConfidence() : 0.0;
    }

    private static Double meanConfidence(List<ScoredIncident> records) {
        OptionalDouble mean = records.stream()
                .map(ScoredIncident::getConfidence)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average();
        return mean.isPresent() ? mean.getAsDouble() : null;
    }
}
