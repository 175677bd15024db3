package com.csd.repograder.service;

import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.ScoreDimension;
import com.csd.repograder.model.SkillLevel;
import com.csd.repograder.model.Tier;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.csd.repograder.service.RepositoryFixtures.scores;
import static org.junit.jupiter.api.Assertions.*;

public class ScoreAggregatorTest {

    private final ScoreAggregator aggregator = new ScoreAggregator();

    @Test
    void sumsScoresAndMaxima() {
        Map<DimensionType, ScoreDimension> scores = scores(12, 7, 20, 5, 6, 9);

        assertEquals(59, aggregator.overallScore(scores));
        assertEquals(100, aggregator.maxScore(scores));
    }

    @Test
    void tierBoundaries() {
        assertEquals(Tier.PLATINUM, Tier.fromPercentage(90.0));
        assertEquals(Tier.GOLD, Tier.fromPercentage(89.99));
        assertEquals(Tier.GOLD, Tier.fromPercentage(75.0));
        assertEquals(Tier.SILVER, Tier.fromPercentage(74.99));
        assertEquals(Tier.SILVER, Tier.fromPercentage(60.0));
        assertEquals(Tier.BRONZE, Tier.fromPercentage(59.99));
        assertEquals(Tier.BRONZE, Tier.fromPercentage(0));
    }

    @Test
    void skillLevelBoundaries() {
        assertEquals(SkillLevel.EXPERT, SkillLevel.fromPercentage(85.0));
        assertEquals(SkillLevel.ADVANCED, SkillLevel.fromPercentage(84.99));
        assertEquals(SkillLevel.ADVANCED, SkillLevel.fromPercentage(70.0));
        assertEquals(SkillLevel.INTERMEDIATE, SkillLevel.fromPercentage(69.99));
        assertEquals(SkillLevel.INTERMEDIATE, SkillLevel.fromPercentage(50.0));
        assertEquals(SkillLevel.BEGINNER, SkillLevel.fromPercentage(49.99));
    }

    @Test
    void classifiesFromIntegerScores() {
        assertEquals(Tier.PLATINUM, aggregator.tier(90, 100));
        assertEquals(Tier.GOLD, aggregator.tier(89, 100));
        assertEquals(SkillLevel.EXPERT, aggregator.skillLevel(85, 100));
        assertEquals(SkillLevel.ADVANCED, aggregator.skillLevel(84, 100));
    }
}
