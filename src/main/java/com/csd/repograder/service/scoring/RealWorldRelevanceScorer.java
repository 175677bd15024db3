package com.csd.repograder.service.scoring;

import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.RepositoryMetadata;
import com.csd.repograder.model.ScoreDimension;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class RealWorldRelevanceScorer implements DimensionScorer {

    @Override
    public DimensionType dimension() {
        return DimensionType.REAL_WORLD_RELEVANCE;
    }

    @Override
    public ScoreDimension score(ScoringContext context) {
        RepositoryMetadata repo = context.getMetadata();
        List<String> feedback = new ArrayList<>();
        int score = 0;

        if (repo.getStars() > 100) {
            score += 4;
            feedback.add("✓ Significant community interest (100+ stars)");
        } else if (repo.getStars() > 10) {
            score += 3;
            feedback.add("⚠ Moderate community interest");
        } else if (repo.getStars() > 0) {
            score += 1;
            feedback.add("⚠ Limited community adoption");
        } else {
            feedback.add("✗ No community engagement yet");
        }

        long daysSincePush = context.daysSince(repo.getPushedAt());
        if (daysSincePush < 7) {
            score += 3;
            feedback.add("✓ Very recent activity (within 7 days)");
        } else if (daysSincePush < 30) {
            score += 2;
            feedback.add("✓ Recent activity (within 30 days)");
        } else {
            feedback.add("⚠ No recent commits - project may be stagnant");
        }

        if (repo.getOpenIssues() == 0) {
            score += 2;
            feedback.add("✓ No open issues - well maintained");
        } else if (repo.getOpenIssues() < 10) {
            score += 1;
            feedback.add("⚠ " + repo.getOpenIssues() + " open issues");
        } else {
            feedback.add("✗ " + repo.getOpenIssues() + " open issues - may need attention");
        }

        // only projects older than a year earn the maturity point
        long daysSinceCreation = context.daysSince(repo.getCreatedAt());
        if (daysSinceCreation > 365) {
            score += 1;
            feedback.add("✓ Mature project (over 1 year old)");
        } else if (daysSinceCreation > 90) {
            feedback.add("⚠ Relatively new project");
        } else {
            feedback.add("⚠ Very new project - still establishing");
        }

        return ScoreDimension.of(score, dimension().getMaxScore(), feedback);
    }
}
