package com.csd.repograder.service;

import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.Priority;
import com.csd.repograder.model.RoadmapItem;
import com.csd.repograder.model.ScoreDimension;
import lombok.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns under-performing dimensions into improvement items.
 * Rules fire in declaration order and the result is cut to {@value #MAX_ITEMS} items without re-sorting.
 */
@Service
public class RoadmapGenerator {

    static final int MAX_ITEMS = 5;

    private static final List<RoadmapRule> RULES = List.of(
            new RoadmapRule(DimensionType.DOCUMENTATION, 0.6, RoadmapItem.builder()
                    .priority(Priority.HIGH)
                    .title("Enhance Documentation")
                    .description("Comprehensive documentation is critical for project adoption and collaboration.")
                    .actionItems(List.of(
                            "Create or expand README with project overview, purpose, and key features",
                            "Add installation and setup instructions with prerequisites",
                            "Include usage examples and code samples",
                            "Add screenshots or GIFs demonstrating functionality",
                            "Document API or main interfaces",
                            "Create CONTRIBUTING.md for collaboration guidelines"))
                    .build()),
            new RoadmapRule(DimensionType.TESTING, 0.5, RoadmapItem.builder()
                    .priority(Priority.HIGH)
                    .title("Implement Testing Strategy")
                    .description("Testing is essential for code quality and maintainability in professional projects.")
                    .actionItems(List.of(
                            "Choose and set up appropriate testing framework for your language",
                            "Write unit tests for core functionality (aim for 70%+ coverage)",
                            "Add integration tests for critical workflows",
                            "Set up CI/CD pipeline (GitHub Actions, Travis, CircleCI)",
                            "Add test coverage reporting and badges",
                            "Document how to run tests in README"))
                    .build()),
            new RoadmapRule(DimensionType.CODE_QUALITY, 0.6, RoadmapItem.builder()
                    .priority(Priority.HIGH)
                    .title("Improve Code Quality")
                    .description("Clean, well-organized code demonstrates professional development practices.")
                    .actionItems(List.of(
                            "Establish consistent code formatting standards",
                            "Add linting configuration (.eslintrc, .pylintrc, etc.)",
                            "Write meaningful commit messages (use conventional commits)",
                            "Refactor long functions into smaller, testable units",
                            "Add code comments for complex logic",
                            "Remove dead code and unused dependencies"))
                    .build()),
            new RoadmapRule(DimensionType.PROJECT_STRUCTURE, 0.6, RoadmapItem.builder()
                    .priority(Priority.MEDIUM)
                    .title("Optimize Project Structure")
                    .description("Well-organized projects are easier to navigate and maintain.")
                    .actionItems(List.of(
                            "Create clear folder structure (src/, tests/, docs/, etc.)",
                            "Add .gitignore for language/framework-specific files",
                            "Include LICENSE file if missing",
                            "Enable GitHub Issues for bug tracking",
                            "Add project description and topics/tags",
                            "Create issue and PR templates"))
                    .build()),
            new RoadmapRule(DimensionType.DEVELOPMENT_PRACTICES, 0.6, RoadmapItem.builder()
                    .priority(Priority.MEDIUM)
                    .title("Establish Development Workflow")
                    .description("Consistent development practices improve collaboration and code quality.")
                    .actionItems(List.of(
                            "Commit code regularly with meaningful messages",
                            "Use feature branches for new development",
                            "Implement code review process via pull requests",
                            "Add CHANGELOG.md to track version history",
                            "Consider semantic versioning for releases",
                            "Set up branch protection rules"))
                    .build()),
            new RoadmapRule(DimensionType.REAL_WORLD_RELEVANCE, 0.5, RoadmapItem.builder()
                    .priority(Priority.LOW)
                    .title("Increase Project Visibility and Impact")
                    .description("Make your project discoverable and useful to others.")
                    .actionItems(List.of(
                            "Add relevant topics/tags to repository",
                            "Share project on developer communities (Reddit, Hacker News, etc.)",
                            "Write blog post or tutorial about the project",
                            "Add project to awesome-lists or curated collections",
                            "Engage with issues and feature requests promptly",
                            "Consider creating a project website or demo"))
                    .build())
    );

    static final RoadmapItem CONTINUE_EXCELLENCE = RoadmapItem.builder()
            .priority(Priority.LOW)
            .title("Continue Excellence")
            .description("Maintain current high standards while exploring new improvements.")
            .actionItems(List.of(
                    "Keep dependencies up to date",
                    "Monitor and address security vulnerabilities",
                    "Expand test coverage to 90%+",
                    "Add performance benchmarks",
                    "Consider internationalization (i18n)",
                    "Explore advanced CI/CD features"))
            .build();

    public List<RoadmapItem> generate(Map<DimensionType, ScoreDimension> scores) {
        List<RoadmapItem> roadmap = new ArrayList<>();
        for (RoadmapRule rule : RULES) {
            if (scores.get(rule.getDimension()).ratio() < rule.getCutoff()) {
                roadmap.add(rule.getItem());
            }
        }

        if (roadmap.isEmpty()) {
            roadmap.add(CONTINUE_EXCELLENCE);
        }

        return List.copyOf(roadmap.subList(0, Math.min(roadmap.size(), MAX_ITEMS)));
    }

    @Value
    private static class RoadmapRule {
        DimensionType dimension;
        double cutoff;
        RoadmapItem item;
    }
}
