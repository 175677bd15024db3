package com.csd.repograder.service.scoring;

import com.csd.repograder.model.RepositoryMetadata;
import com.csd.repograder.model.ScoreDimension;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.csd.repograder.service.RepositoryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class RealWorldRelevanceScorerTest {

    private final RealWorldRelevanceScorer scorer = new RealWorldRelevanceScorer();

    @Test
    void popularActiveMatureProject() {
        RepositoryMetadata repo = bareRepo()
                .stars(150)
                .pushedAt(daysAgo(2))
                .openIssues(0)
                .createdAt(daysAgo(400))
                .build();

        ScoreDimension result = scorer.score(context(repo));

        assertEquals(10, result.getScore());
        assertEquals(List.of(
                "✓ Significant community interest (100+ stars)",
                "✓ Very recent activity (within 7 days)",
                "✓ No open issues - well maintained",
                "✓ Mature project (over 1 year old)"
        ), result.getFeedback());
    }

    @Test
    void unknownStagnantNewProject() {
        RepositoryMetadata repo = bareRepo()
                .pushedAt(daysAgo(45))
                .openIssues(12)
                .createdAt(daysAgo(30))
                .build();

        ScoreDimension result = scorer.score(context(repo));

        assertEquals(0, result.getScore());
        assertEquals(List.of(
                "✗ No community engagement yet",
                "⚠ No recent commits - project may be stagnant",
                "✗ 12 open issues - may need attention",
                "⚠ Very new project - still establishing"
        ), result.getFeedback());
    }

    @Test
    void relativelyNewProjectEarnsNoMaturityPoint() {
        RepositoryMetadata repo = bareRepo()
                .stars(20)
                .pushedAt(daysAgo(10))
                .openIssues(4)
                .createdAt(daysAgo(200))
                .build();

        ScoreDimension result = scorer.score(context(repo));

        // 3 stars + 2 recency + 1 issues + 0 maturity
        assertEquals(6, result.getScore());
        assertEquals(List.of(
                "⚠ Moderate community interest",
                "✓ Recent activity (within 30 days)",
                "⚠ 4 open issues",
                "⚠ Relatively new project"
        ), result.getFeedback());
    }

    @Test
    void singleStarIsLimitedAdoption() {
        ScoreDimension result = scorer.score(context(bareRepo().stars(1).build()));

        assertEquals("⚠ Limited community adoption", result.getFeedback().get(0));
    }
}
