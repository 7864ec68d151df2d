package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.FraudAnalysisResult;
import com.hieshield.frauddetector.domain.FraudType;
import com.hieshield.frauddetector.domain.PatientCaseBundle;
import com.hieshield.frauddetector.domain.ProcedureClaim;
import com.hieshield.frauddetector.domain.RiskLevel;
import com.hieshield.frauddetector.domain.Violation;
import com.hieshield.frauddetector.domain.ViolationEvidence;
import com.hieshield.frauddetector.exception.FraudComputationException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Rule-based fraud analysis of one patient's procedure claims.
 *
 * <p>Claims are classified once, then run through the anatomical,
 * cross-provider and temporal detectors. Their violations are concatenated in
 * that order, scored, tiered and annotated with recommendations and evidence.
 * The engine holds no mutable state and is safe to share between threads;
 * the only outside input is the clock used for the analysis timestamp.
 */
public class FraudDetectionEngine {

    private final ProcedureClassifier classifier;
    private final List<ViolationDetector> detectors;
    private final ScoreAggregator scoreAggregator;
    private final RiskClassifier riskClassifier;
    private final RecommendationGenerator recommendationGenerator;
    private final EvidenceExplainer evidenceExplainer;
    private final Clock clock;

    public FraudDetectionEngine(AnatomicalLimits limits, Clock clock) {
        this(new ProcedureClassifier(), limits, clock);
    }

    public FraudDetectionEngine(ProcedureClassifier classifier, AnatomicalLimits limits, Clock clock) {
        this.classifier = classifier;
        this.detectors = List.of(
                new AnatomicalRuleChecker(limits),
                new CrossProviderPatternDetector(),
                new TemporalAnomalyDetector());
        this.scoreAggregator = new ScoreAggregator();
        this.riskClassifier = new RiskClassifier();
        this.recommendationGenerator = new RecommendationGenerator();
        this.evidenceExplainer = new EvidenceExplainer(classifier);
        this.clock = clock;
    }

    public FraudAnalysisResult analyze(PatientCaseBundle bundle) {
        return analyze(bundle.getPatientId(), bundle.getClaims());
    }

    /**
     * @throws FraudComputationException if the analysis fails on the given claims
     */
    public FraudAnalysisResult analyze(String patientId, List<ProcedureClaim> procedures) {
        Objects.requireNonNull(procedures, "procedures");
        try {
            List<ClassifiedClaim> classified = classifier.classifyAll(procedures);

            List<Violation> violations = new ArrayList<>();
            for (ViolationDetector detector : detectors) {
                violations.addAll(detector.detect(classified));
            }

            double fraudScore = scoreAggregator.score(violations);
            RiskLevel riskLevel = riskClassifier.classify(fraudScore);
            List<String> recommendations = recommendationGenerator.recommend(violations, fraudScore);
            List<ViolationEvidence> evidence = evidenceExplainer.explainAll(violations, procedures);

            return new FraudAnalysisResult(
                    patientId,
                    fraudScore,
                    riskLevel,
                    FraudType.of(violations),
                    violations,
                    evidence,
                    totalAmount(procedures),
                    procedures.size(),
                    hospitalCount(procedures),
                    recommendations,
                    OffsetDateTime.now(clock));
        } catch (FraudComputationException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new FraudComputationException("Fraud analysis failed for patient " + patientId, e);
        }
    }

    private static BigDecimal totalAmount(List<ProcedureClaim> procedures) {
        return procedures.stream()
                .map(ProcedureClaim::getAmount)
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static int hospitalCount(List<ProcedureClaim> procedures) {
        return (int) procedures.stream()
                .map(ProcedureClaim::getHospital)
                .filter(Objects::nonNull)
                .distinct()
                .count();
    }

    public ProcedureClassifier getClassifier() {
        return classifier;
    }

    public EvidenceExplainer getEvidenceExplainer() {
        return evidenceExplainer;
    }
}
