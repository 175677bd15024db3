package com.csd.repograder.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ScoreDimension {
    int score;
    int maxScore;
    List<String> feedback; // evaluation order, each line starts with ✓, ⚠ or ✗

    public static ScoreDimension of(int score, int maxScore, List<String> feedback) {
        return ScoreDimension.builder()
                .score(Math.max(0, Math.min(score, maxScore)))
                .maxScore(maxScore)
                .feedback(List.copyOf(feedback))
                .build();
    }

    public double ratio() {
        return (double) score / maxScore;
    }

    public double percentage() {
        return ratio() * 100;
    }
}
