package com.csd.repograder.service.scoring;

import com.csd.repograder.model.CommitHistory;
import com.csd.repograder.model.CommitRecord;
import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.RepositoryMetadata;
import com.csd.repograder.model.ScoreDimension;
import com.csd.repograder.service.TimeUtil;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class DevelopmentPracticesScorer implements DimensionScorer {

    static final int MIN_COMMITS_FOR_CADENCE = 5;
    static final int CADENCE_WINDOW = 10;

    @Override
    public DimensionType dimension() {
        return DimensionType.DEVELOPMENT_PRACTICES;
    }

    @Override
    public ScoreDimension score(ScoringContext context) {
        RepositoryMetadata repo = context.getMetadata();
        CommitHistory history = context.getHistory();
        List<String> feedback = new ArrayList<>();
        int score = 0;

        // no line at all for an empty history
        if (history.getTotalCount() > 50) {
            score += 5;
            feedback.add("✓ Strong commit history (50+ commits)");
        } else if (history.getTotalCount() > 10) {
            score += 3;
            feedback.add("⚠ Moderate commit history");
        } else if (history.getTotalCount() > 0) {
            score += 1;
            feedback.add("✗ Limited commit history - needs more development");
        }

        if (history.getCommits().size() >= MIN_COMMITS_FOR_CADENCE) {
            double daysBetween = averageDaysBetweenCommits(history.getCommits());
            if (daysBetween < 14) {
                score += 3;
                feedback.add("✓ Regular commit cadence (commits every 2 weeks or less)");
            } else if (daysBetween < 30) {
                score += 2;
                feedback.add("⚠ Irregular commit pattern");
            } else {
                score += 1;
                feedback.add("✗ Infrequent commits - establish a regular development schedule");
            }
        }

        String branch = repo.getDefaultBranch();
        if ("main".equals(branch) || "master".equals(branch)) {
            score += 2;
            feedback.add("✓ Standard default branch name: " + branch);
        }

        long daysSinceCreation = context.daysSince(repo.getCreatedAt());
        long daysSinceUpdate = context.daysSince(repo.getUpdatedAt());
        if (daysSinceUpdate < daysSinceCreation * 0.1) {
            score += 3;
            feedback.add("✓ Actively maintained throughout its lifetime");
        } else if (daysSinceUpdate < daysSinceCreation * 0.5) {
            score += 2;
            feedback.add("⚠ Some periods of inactivity");
        } else {
            feedback.add("✗ Long periods without updates");
        }

        if (repo.hasLicense()) {
            score += 2;
            feedback.add("✓ Proper licensing encourages collaboration");
        } else {
            feedback.add("✗ Add a license for legal clarity");
        }

        return ScoreDimension.of(score, dimension().getMaxScore(), feedback);
    }

    /**
     * Mean gap between consecutive commits among the newest {@value #CADENCE_WINDOW}, in days.
     * Commits are newest-first, so each gap is the earlier entry minus the later one.
     */
    static double averageDaysBetweenCommits(List<CommitRecord> commits) {
        int window = Math.min(commits.size(), CADENCE_WINDOW);
        long totalMillis = 0;
        for (int i = 1; i < window; i++) {
            totalMillis += commits.get(i - 1).getAuthorDate().toEpochMilli()
                    - commits.get(i).getAuthorDate().toEpochMilli();
        }
        return TimeUtil.millisToDays((double) totalMillis / (window - 1));
    }
}
