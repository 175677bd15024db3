package com.csd.repograder.service.scoring;

import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.RepositoryMetadata;
import com.csd.repograder.model.ScoreDimension;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ProjectStructureScorer implements DimensionScorer {

    @Override
    public DimensionType dimension() {
        return DimensionType.PROJECT_STRUCTURE;
    }

    @Override
    public ScoreDimension score(ScoringContext context) {
        RepositoryMetadata repo = context.getMetadata();
        List<String> feedback = new ArrayList<>();
        int score = 0;

        String description = repo.getDescription();
        if (description != null && description.length() > 20) {
            score += 4;
            feedback.add("✓ Clear and descriptive project description");
        } else if (description != null && !description.isEmpty()) {
            score += 2;
            feedback.add("⚠ Project description is too brief");
        } else {
            feedback.add("✗ Missing project description - add one to explain the purpose");
        }

        if (repo.isIssuesEnabled()) {
            score += 3;
            feedback.add("✓ Issues enabled for bug tracking and feature requests");
        }

        if (repo.isWikiEnabled()) {
            score += 2;
            feedback.add("✓ Wiki enabled for extended documentation");
        }

        if (repo.isProjectsEnabled()) {
            score += 2;
            feedback.add("✓ Projects enabled for task management");
        }

        if (repo.getStars() > 10) {
            score += 2;
            feedback.add("✓ " + repo.getStars() + " stars - community interest demonstrated");
        } else if (repo.getStars() > 0) {
            score += 1;
            feedback.add("⚠ " + repo.getStars() + " stars - limited community engagement");
        } else {
            feedback.add("✗ No stars - consider promoting the project");
        }

        if (repo.getForks() > 0) {
            score += 2;
            feedback.add("✓ " + repo.getForks() + " forks - code is being reused");
        } else {
            feedback.add("⚠ No forks yet");
        }

        return ScoreDimension.of(score, dimension().getMaxScore(), feedback);
    }
}
