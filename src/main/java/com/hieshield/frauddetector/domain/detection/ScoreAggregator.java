package com.hieshield.frauddetector.domain.detection;

import com.hieshield.frauddetector.domain.Violation;

import java.util.List;

/**
 * Linear sum of severity weights, clamped to [0, 1]. Scores past 1.0 saturate
 * rather than being rescaled.
 */
public class ScoreAggregator {

    public double score(List<Violation> violations) {
        double sum = 0.0;
        for (Violation v : violations) {
            sum += v.getSeverity().getWeight();
        }
        return Math.max(0.0, Math.min(sum, 1.0));
    }
}
