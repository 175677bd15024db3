package com.csd.repograder.service.scoring;

import com.csd.repograder.model.ScoreDimension;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.csd.repograder.service.RepositoryFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestingScorerTest {

    private final TestingScorer scorer = new TestingScorer();

    @Test
    void coverageCiAndFramework() {
        String readme = "Test coverage: 95%\nBuilt with GitHub Actions and tested with Jest.";

        ScoreDimension result = scorer.score(context(bareRepo().readme(readme).build()));

        assertEquals(13, result.getScore());
        assertEquals(List.of(
                "✓ Test coverage mentioned in documentation",
                "✓ CI/CD pipeline detected",
                "✓ Testing framework mentioned"
        ), result.getFeedback());
    }

    @Test
    void missingReadmeGetsParticipationFloor() {
        ScoreDimension result = scorer.score(context(bareRepo().build()));

        assertEquals(2, result.getScore());
        assertEquals(List.of(
                "✗ No testing information in documentation",
                "✗ No CI/CD pipeline detected - consider adding automated tests",
                "⚠ Consider adding unit and integration tests",
                "⚠ Set up automated testing with CI/CD"
        ), result.getFeedback());
    }

    @Test
    void testMentionAloneStillBelowFloor() {
        ScoreDimension result = scorer.score(context(bareRepo().readme("Run the test suite before pushing.").build()));

        assertEquals(5, result.getScore());
        assertEquals("⚠ Testing mentioned but coverage unclear", result.getFeedback().get(0));
        assertEquals(4, result.getFeedback().size());
    }

    @Test
    void frameworkLiftsAboveFloor() {
        ScoreDimension result = scorer.score(context(bareRepo().readme("Tests run under pytest.").build()));

        assertEquals(6, result.getScore());
        assertEquals(List.of(
                "⚠ Testing mentioned but coverage unclear",
                "✗ No CI/CD pipeline detected - consider adding automated tests",
                "✓ Testing framework mentioned"
        ), result.getFeedback());
    }

    @Test
    void ciWithoutTestsGetsNoFloor() {
        ScoreDimension result = scorer.score(context(bareRepo().readme("See the release workflow.").build()));

        assertEquals(5, result.getScore());
        assertEquals(2, result.getFeedback().size());
    }
}
