package com.csd.repograder.service.scoring;

import com.csd.repograder.model.CommitRecord;
import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.RepositoryMetadata;
import com.csd.repograder.model.ScoreDimension;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CodeQualityScorer implements DimensionScorer {

    @Override
    public DimensionType dimension() {
        return DimensionType.CODE_QUALITY;
    }

    @Override
    public ScoreDimension score(ScoringContext context) {
        RepositoryMetadata repo = context.getMetadata();
        List<CommitRecord> commits = context.getHistory().getCommits();
        List<String> feedback = new ArrayList<>();
        int score = 0;

        if (repo.getLanguage() != null && !repo.getLanguage().isEmpty()) {
            score += 3;
            feedback.add("✓ Primary language identified: " + repo.getLanguage());
        } else {
            feedback.add("✗ No primary programming language detected");
        }

        int languageCount = repo.getLanguages().size();
        if (languageCount > 1) {
            score += 2;
            feedback.add("✓ Uses " + languageCount + " programming languages, showing technical diversity");
        }

        long daysSinceUpdate = context.daysSince(repo.getUpdatedAt());
        if (daysSinceUpdate < 30) {
            score += 5;
            feedback.add("✓ Recently updated (within last 30 days)");
        } else if (daysSinceUpdate < 90) {
            score += 3;
            feedback.add("⚠ Updated within last 90 days");
        } else {
            feedback.add("✗ No recent updates - repository may be abandoned");
        }

        if (!commits.isEmpty()) {
            long goodCommits = commits.stream().filter(CodeQualityScorer::isGoodCommit).count();
            double commitQuality = (double) goodCommits / commits.size() * 100;
            if (commitQuality > 70) {
                score += 5;
                feedback.add("✓ Good commit message quality (descriptive and meaningful)");
            } else if (commitQuality > 40) {
                score += 3;
                feedback.add("⚠ Commit messages could be more descriptive");
            } else {
                score += 1;
                feedback.add("✗ Poor commit message quality - use meaningful descriptions");
            }
        }

        if (repo.getSize() > 1000) {
            score += 3;
            feedback.add("✓ Substantial codebase size indicating significant development");
        } else if (repo.getSize() > 100) {
            score += 2;
            feedback.add("⚠ Moderate codebase size");
        } else {
            feedback.add("✗ Small codebase - may lack comprehensive features");
        }

        if (repo.hasLicense()) {
            score += 2;
            feedback.add("✓ Licensed under " + repo.getLicense().getName());
        } else {
            feedback.add("✗ No license file - important for open source projects");
        }

        return ScoreDimension.of(score, dimension().getMaxScore(), feedback);
    }

    /**
     * A message longer than 10 characters that is not a default "Update &lt;file&gt;" message.
     * The prefix check is case-sensitive.
     */
    static boolean isGoodCommit(CommitRecord commit) {
        String message = commit.getMessage();
        return message.length() > 10 && !message.startsWith("Update ");
    }
}
