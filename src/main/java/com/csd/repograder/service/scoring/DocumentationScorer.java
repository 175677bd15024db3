package com.csd.repograder.service.scoring;

import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.RepositoryMetadata;
import com.csd.repograder.model.ScoreDimension;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Scores the README: its length plus case-insensitive checks for the sections a reader expects.
 */
@Component
public class DocumentationScorer implements DimensionScorer {

    @Override
    public DimensionType dimension() {
        return DimensionType.DOCUMENTATION;
    }

    @Override
    public ScoreDimension score(ScoringContext context) {
        RepositoryMetadata repo = context.getMetadata();
        List<String> feedback = new ArrayList<>();
        int score = 0;

        if (!repo.hasReadme()) {
            feedback.add("✗ README file is missing - this is critical for any repository");
            feedback.add("✗ Without README, potential users cannot understand the project");
            return ScoreDimension.of(score, dimension().getMaxScore(), feedback);
        }

        int readmeLength = repo.getReadme().length();
        if (readmeLength > 2000) {
            score += 10;
            feedback.add("✓ Comprehensive README (2000+ characters)");
        } else if (readmeLength > 500) {
            score += 6;
            feedback.add("⚠ Moderate README length - consider adding more details");
        } else {
            score += 3;
            feedback.add("✗ README is too brief - expand with setup, usage, and examples");
        }

        String readme = repo.getReadme().toLowerCase(Locale.ROOT);

        if (containsAny(readme, "install", "setup")) {
            score += 3;
            feedback.add("✓ Installation/setup instructions included");
        } else {
            feedback.add("✗ Missing installation instructions");
        }

        if (containsAny(readme, "usage", "example")) {
            score += 3;
            feedback.add("✓ Usage examples provided");
        } else {
            feedback.add("✗ No usage examples - add code samples");
        }

        if (containsAny(readme, "contributing", "contribution")) {
            score += 2;
            feedback.add("✓ Contribution guidelines included");
        }

        if (readme.contains("license")) {
            score += 2;
            feedback.add("✓ License information in README");
        }

        if (containsAny(readme, "![", "<img")) {
            score += 2;
            feedback.add("✓ Includes images/screenshots for visual clarity");
        } else {
            feedback.add("⚠ Consider adding screenshots or diagrams");
        }

        if (containsAny(readme, "```", "`")) {
            score += 2;
            feedback.add("✓ Code examples formatted properly");
        }

        if (containsAny(readme, "badge", "shields.io", "img.shields.io")) {
            score += 1;
            feedback.add("✓ Status badges present");
        }

        return ScoreDimension.of(score, dimension().getMaxScore(), feedback);
    }

    static boolean containsAny(String text, String... needles) {
        for (String needle : needles) {
            if (text.contains(needle)) {
                return true;
            }
        }
        return false;
    }
}
