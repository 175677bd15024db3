package com.csd.repograder.service.scoring;

import com.csd.repograder.model.ScoreDimension;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.csd.repograder.service.RepositoryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class DocumentationScorerTest {

    private final DocumentationScorer scorer = new DocumentationScorer();

    @Test
    void missingReadmeShortCircuits() {
        ScoreDimension result = scorer.score(context(bareRepo().build()));

        assertEquals(0, result.getScore());
        assertEquals(25, result.getMaxScore());
        assertEquals(List.of(
                "✗ README file is missing - this is critical for any repository",
                "✗ Without README, potential users cannot understand the project"
        ), result.getFeedback());
    }

    @Test
    void emptyReadmeIsMissing() {
        ScoreDimension result = scorer.score(context(bareRepo().readme("").build()));

        assertEquals(0, result.getScore());
        assertEquals(2, result.getFeedback().size());
    }

    @Test
    void briefReadmeStillEarnsBasePoints() {
        ScoreDimension result = scorer.score(context(bareRepo().readme("# Demo\n").build()));

        assertEquals(3, result.getScore());
        assertEquals(List.of(
                "✗ README is too brief - expand with setup, usage, and examples",
                "✗ Missing installation instructions",
                "✗ No usage examples - add code samples",
                "⚠ Consider adding screenshots or diagrams"
        ), result.getFeedback());
    }

    @Test
    void completeReadmeScoresMaximum() {
        String readme = "[![Build](https://img.shields.io/badge/build-passing-green)](ci)\n"
                + "## Installation\n\n```bash\nmvn install\n```\n"
                + "## Usage\n\nRun `repo-grader`.\n"
                + "![screenshot](docs/screen.png)\n"
                + "## Contributing\n\nPull requests welcome.\n"
                + "## License\n\nMIT\n"
                + "x".repeat(2000);

        ScoreDimension result = scorer.score(context(bareRepo().readme(readme).build()));

        assertEquals(25, result.getScore());
        assertEquals(List.of(
                "✓ Comprehensive README (2000+ characters)",
                "✓ Installation/setup instructions included",
                "✓ Usage examples provided",
                "✓ Contribution guidelines included",
                "✓ License information in README",
                "✓ Includes images/screenshots for visual clarity",
                "✓ Code examples formatted properly",
                "✓ Status badges present"
        ), result.getFeedback());
    }

    @Test
    void keywordMatchingIgnoresCase() {
        String readme = "SETUP\nEXAMPLE\n" + "y".repeat(600);

        ScoreDimension result = scorer.score(context(bareRepo().readme(readme).build()));

        // 6 length + 3 setup + 3 example
        assertEquals(12, result.getScore());
        assertEquals("⚠ Moderate README length - consider adding more details", result.getFeedback().get(0));
    }
}
