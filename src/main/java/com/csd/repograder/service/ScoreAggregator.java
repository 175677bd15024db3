package com.csd.repograder.service;

import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.ScoreDimension;
import com.csd.repograder.model.SkillLevel;
import com.csd.repograder.model.Tier;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class ScoreAggregator {

    public int overallScore(Map<DimensionType, ScoreDimension> scores) {
        return scores.values().stream().mapToInt(ScoreDimension::getScore).sum();
    }

    public int maxScore(Map<DimensionType, ScoreDimension> scores) {
        return scores.values().stream().mapToInt(ScoreDimension::getMaxScore).sum();
    }

    public static double percentage(int score, int maxScore) {
        return (double) score / maxScore * 100;
    }

    public SkillLevel skillLevel(int score, int maxScore) {
        return SkillLevel.fromPercentage(percentage(score, maxScore));
    }

    public Tier tier(int score, int maxScore) {
        return Tier.fromPercentage(percentage(score, maxScore));
    }
}
