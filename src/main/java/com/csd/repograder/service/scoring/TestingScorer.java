package com.csd.repograder.service.scoring;

import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.ScoreDimension;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.csd.repograder.service.scoring.DocumentationScorer.containsAny;

/**
 * Estimates testing maturity from the README only; the file tree is never inspected.
 */
@Component
public class TestingScorer implements DimensionScorer {

    private static final String[] CI_KEYWORDS = {
            "travis", "circleci", "github actions", "build passing", "workflow"
    };

    private static final String[] TESTING_FRAMEWORKS = {
            "jest", "mocha", "pytest", "junit", "rspec", "phpunit", "unittest"
    };

    @Override
    public DimensionType dimension() {
        return DimensionType.TESTING;
    }

    @Override
    public ScoreDimension score(ScoringContext context) {
        String rawReadme = context.getMetadata().getReadme();
        String readme = rawReadme == null ? "" : rawReadme.toLowerCase(Locale.ROOT);
        List<String> feedback = new ArrayList<>();
        int score = 0;

        if (readme.contains("test") && readme.contains("coverage")) {
            score += 5;
            feedback.add("✓ Test coverage mentioned in documentation");
        } else if (readme.contains("test")) {
            score += 3;
            feedback.add("⚠ Testing mentioned but coverage unclear");
        } else {
            feedback.add("✗ No testing information in documentation");
        }

        if (containsAny(readme, CI_KEYWORDS)) {
            score += 5;
            feedback.add("✓ CI/CD pipeline detected");
        } else {
            feedback.add("✗ No CI/CD pipeline detected - consider adding automated tests");
        }

        if (containsAny(readme, TESTING_FRAMEWORKS)) {
            score += 3;
            feedback.add("✓ Testing framework mentioned");
        }

        // participation floor, applied after every other check
        if (score < 5) {
            feedback.add("⚠ Consider adding unit and integration tests");
            feedback.add("⚠ Set up automated testing with CI/CD");
            score += 2;
        }

        return ScoreDimension.of(score, dimension().getMaxScore(), feedback);
    }
}
