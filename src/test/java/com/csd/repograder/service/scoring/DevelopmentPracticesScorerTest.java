package com.csd.repograder.service.scoring;

import com.csd.repograder.model.RepositoryMetadata;
import com.csd.repograder.model.ScoreDimension;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.csd.repograder.service.RepositoryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class DevelopmentPracticesScorerTest {

    private final DevelopmentPracticesScorer scorer = new DevelopmentPracticesScorer();

    @Test
    void weeklyCommitsEarnCadenceBonus() {
        RepositoryMetadata repo = bareRepo()
                .defaultBranch("main")
                .createdAt(daysAgo(1000))
                .updatedAt(daysAgo(5))
                .license(mit())
                .build();

        ScoreDimension result = scorer.score(context(repo, commits(5, 7, "Add weekly report generation")));

        // 1 history + 3 cadence + 2 branch + 3 lifetime + 2 license
        assertEquals(11, result.getScore());
        assertEquals(List.of(
                "✗ Limited commit history - needs more development",
                "✓ Regular commit cadence (commits every 2 weeks or less)",
                "✓ Standard default branch name: main",
                "✓ Actively maintained throughout its lifetime",
                "✓ Proper licensing encourages collaboration"
        ), result.getFeedback());
    }

    @Test
    void averageGapUsesNewestTenCommits() {
        assertEquals(7.0, DevelopmentPracticesScorer.averageDaysBetweenCommits(commits(5, 7, "m").getCommits()), 1e-9);
        assertEquals(35.0, DevelopmentPracticesScorer.averageDaysBetweenCommits(commits(60, 35, "m").getCommits()), 1e-9);
    }

    @Test
    void emptyHistoryEmitsNoCommitLine() {
        ScoreDimension result = scorer.score(context(bareRepo().build()));

        assertEquals(0, result.getScore());
        assertEquals(List.of(
                "✗ Long periods without updates",
                "✗ Add a license for legal clarity"
        ), result.getFeedback());
    }

    @Test
    void strongHistoryWithSparseCadence() {
        RepositoryMetadata repo = bareRepo()
                .defaultBranch("master")
                .createdAt(daysAgo(1000))
                .updatedAt(daysAgo(300))
                .build();

        ScoreDimension result = scorer.score(context(repo, commits(60, 35, "Implement incremental sync")));

        // 5 history + 1 cadence + 2 branch + 2 lifetime
        assertEquals(10, result.getScore());
        assertEquals("✓ Strong commit history (50+ commits)", result.getFeedback().get(0));
        assertEquals("✗ Infrequent commits - establish a regular development schedule", result.getFeedback().get(1));
        assertEquals("⚠ Some periods of inactivity", result.getFeedback().get(3));
    }

    @Test
    void fewerThanFiveCommitsSkipCadence() {
        ScoreDimension result = scorer.score(context(bareRepo().build(), commits(4, 20, "Tweak the build script")));

        assertEquals(1, result.getScore());
        assertEquals(List.of(
                "✗ Limited commit history - needs more development",
                "✗ Long periods without updates",
                "✗ Add a license for legal clarity"
        ), result.getFeedback());
    }

    @Test
    void irregularCadence() {
        ScoreDimension result = scorer.score(context(bareRepo().build(), commits(12, 20, "Tweak the build script")));

        // 3 history + 2 cadence
        assertEquals(5, result.getScore());
        assertEquals("⚠ Irregular commit pattern", result.getFeedback().get(1));
    }
}
