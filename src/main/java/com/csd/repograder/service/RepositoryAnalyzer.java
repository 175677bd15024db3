package com.csd.repograder.service;

import com.csd.repograder.exception.InvalidInputException;
import com.csd.repograder.model.AnalysisResult;
import com.csd.repograder.model.CommitHistory;
import com.csd.repograder.model.CommitRecord;
import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.RepositoryMetadata;
import com.csd.repograder.model.ScoreDimension;
import com.csd.repograder.service.scoring.DimensionScorer;
import com.csd.repograder.service.scoring.ScoringContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Analysis engine: runs every dimension scorer over already-fetched data, aggregates the
 * scores and derives the summary and roadmap.
 *
 * <p>Stateless and synchronous. The current time is read once per call and shared by all
 * scorers, so the same input and instant always produce an equal result.</p>
 */
@Slf4j
@Service
public class RepositoryAnalyzer {

    private final Map<DimensionType, DimensionScorer> scorers = new EnumMap<>(DimensionType.class);
    private final ScoreAggregator aggregator;
    private final SummaryGenerator summaryGenerator;
    private final RoadmapGenerator roadmapGenerator;
    private final Clock clock;

    public RepositoryAnalyzer(List<DimensionScorer> scorers,
                              ScoreAggregator aggregator,
                              SummaryGenerator summaryGenerator,
                              RoadmapGenerator roadmapGenerator,
                              Clock clock) {
        for (DimensionScorer scorer : scorers) {
            if (this.scorers.put(scorer.dimension(), scorer) != null) {
                throw new IllegalStateException("Duplicate scorer for dimension " + scorer.dimension());
            }
        }
        for (DimensionType type : DimensionType.values()) {
            if (!this.scorers.containsKey(type)) {
                throw new IllegalStateException("No scorer registered for dimension " + type);
            }
        }
        this.aggregator = aggregator;
        this.summaryGenerator = summaryGenerator;
        this.roadmapGenerator = roadmapGenerator;
        this.clock = clock;
    }

    public AnalysisResult analyze(RepositoryMetadata metadata, CommitHistory history, String identifier) {
        return analyze(metadata, history, identifier, clock.instant());
    }

    public AnalysisResult analyze(RepositoryMetadata metadata, CommitHistory history, String identifier, Instant now) {
        validate(metadata, history, identifier);
        log.debug("Analyzing {} as of {}", identifier, now);

        ScoringContext context = ScoringContext.builder()
                .metadata(metadata)
                .history(history)
                .now(now)
                .build();

        Map<DimensionType, ScoreDimension> scores = new EnumMap<>(DimensionType.class);
        for (DimensionType type : DimensionType.values()) {
            ScoreDimension dimension = scorers.get(type).score(context);
            log.debug("{} {}: {}/{}", identifier, type, dimension.getScore(), dimension.getMaxScore());
            scores.put(type, dimension);
        }
        Map<DimensionType, ScoreDimension> frozenScores = Collections.unmodifiableMap(scores);

        int overallScore = aggregator.overallScore(frozenScores);
        int maxScore = aggregator.maxScore(frozenScores);

        AnalysisResult result = AnalysisResult.builder()
                .repositoryName(identifier)
                .scores(frozenScores)
                .overallScore(overallScore)
                .maxScore(maxScore)
                .skillLevel(aggregator.skillLevel(overallScore, maxScore))
                .tier(aggregator.tier(overallScore, maxScore))
                .summary(summaryGenerator.generate(metadata, frozenScores, overallScore, maxScore, now))
                .roadmap(roadmapGenerator.generate(frozenScores))
                .build();

        log.info("Analysis of {} complete: {}/{} ({}, {})", identifier, overallScore, maxScore,
                result.getTier(), result.getSkillLevel());
        return result;
    }

    private void validate(RepositoryMetadata metadata, CommitHistory history, String identifier) {
        if (identifier == null || identifier.isBlank()) {
            throw new InvalidInputException("Repository identifier is required");
        }
        if (metadata == null) {
            throw new InvalidInputException("Repository metadata is required for " + identifier);
        }
        if (history == null) {
            throw new InvalidInputException("Commit history is required for " + identifier);
        }
        requirePresent(metadata.getName(), "name", identifier);
        requirePresent(metadata.getCreatedAt(), "createdAt", identifier);
        requirePresent(metadata.getUpdatedAt(), "updatedAt", identifier);
        requirePresent(metadata.getPushedAt(), "pushedAt", identifier);
        for (CommitRecord commit : history.getCommits()) {
            requirePresent(commit, "commit", identifier);
            requirePresent(commit.getMessage(), "commit message", identifier);
            requirePresent(commit.getAuthorDate(), "commit author date", identifier);
        }
    }

    private static void requirePresent(Object value, String field, String identifier) {
        if (value == null) {
            throw new InvalidInputException("Missing required field '" + field + "' for " + identifier);
        }
    }
}
