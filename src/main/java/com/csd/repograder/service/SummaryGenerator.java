package com.csd.repograder.service;

import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.RepositoryMetadata;
import com.csd.repograder.model.ScoreDimension;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the Markdown narrative shown above the per-dimension scores.
 */
@Service
public class SummaryGenerator {

    static final double STRENGTH_THRESHOLD = 70;
    static final double WEAKNESS_THRESHOLD = 40;

    public String generate(RepositoryMetadata repo,
                           Map<DimensionType, ScoreDimension> scores,
                           int overallScore,
                           int maxScore,
                           Instant now) {
        double percentage = ScoreAggregator.percentage(overallScore, maxScore);
        List<String> strengths = new ArrayList<>();
        List<String> weaknesses = new ArrayList<>();

        scores.forEach((type, dimension) -> {
            double dimensionPercentage = dimension.percentage();
            if (dimensionPercentage >= STRENGTH_THRESHOLD) {
                strengths.add(type.getDisplayName());
            } else if (dimensionPercentage < WEAKNESS_THRESHOLD) {
                weaknesses.add(type.getDisplayName());
            }
        });

        StringBuilder sb = new StringBuilder();
        sb.append("## Professional Repository Evaluation\n\n");

        String scoreText = String.format(Locale.ROOT, "**%d/%d (%.1f%%)**", overallScore, maxScore, percentage);
        if (percentage >= 80) {
            sb.append("This repository demonstrates **excellent** software engineering practices with a score of ")
                    .append(scoreText).append(". ");
        } else if (percentage >= 65) {
            sb.append("This repository shows **strong** development practices with a score of ")
                    .append(scoreText).append(". ");
        } else if (percentage >= 50) {
            sb.append("This repository has a **solid foundation** with a score of ")
                    .append(scoreText).append(". ");
        } else {
            sb.append("This repository has **significant room for improvement** with a score of ")
                    .append(scoreText).append(". ");
        }

        if (!strengths.isEmpty()) {
            sb.append("The codebase excels in ").append(lowerJoin(strengths, ", "));
            sb.append(strengths.size() == 1 ? ". " : ", demonstrating professional quality in these areas. ");
        }

        if (!weaknesses.isEmpty()) {
            sb.append("However, there are notable gaps in ").append(lowerJoin(weaknesses, ", "));
            sb.append(weaknesses.size() == 1 ? ". " : " that should be addressed. ");
        }

        appendKeyObservations(sb, repo, scores, now);

        sb.append("\n### Recommendation\n\n");
        if (percentage >= 75) {
            sb.append("This repository is well-positioned for professional use or portfolio inclusion. ")
                    .append("Focus on maintaining current standards while addressing any remaining gaps in ")
                    .append(weaknesses.isEmpty() ? "minor areas" : lowerJoin(weaknesses, " and "))
                    .append(".");
        } else if (percentage >= 60) {
            sb.append("The repository has strong potential but requires improvements in key areas. ")
                    .append("Prioritize enhancing ")
                    .append(weaknesses.isEmpty() ? "weaker dimensions" : weaknesses.get(0).toLowerCase(Locale.ROOT))
                    .append(" to meet professional standards.");
        } else {
            sb.append("Significant improvements are needed before this repository can be considered ")
                    .append("production-ready or portfolio-worthy. Start with the high-priority items in the ")
                    .append("roadmap below, focusing particularly on ")
                    .append(weaknesses.isEmpty() ? "foundational improvements" : weaknesses.get(0).toLowerCase(Locale.ROOT))
                    .append(".");
        }

        return sb.toString();
    }

    private void appendKeyObservations(StringBuilder sb,
                                       RepositoryMetadata repo,
                                       Map<DimensionType, ScoreDimension> scores,
                                       Instant now) {
        sb.append("\n\n### Key Observations\n\n");

        if (repo.hasReadme() && repo.getReadme().length() > 1000) {
            sb.append("- **Documentation**: Comprehensive README provides clear project information\n");
        } else if (!repo.hasReadme()) {
            sb.append("- **Documentation**: Missing README file is a critical issue that must be addressed immediately\n");
        }

        if (scores.get(DimensionType.CODE_QUALITY).ratio() > 0.7) {
            sb.append("- **Code Quality**: Shows consistent development practices and meaningful commit history\n");
        }

        if (scores.get(DimensionType.TESTING).ratio() < 0.4) {
            sb.append("- **Testing**: Lacks visible testing infrastructure - implement automated tests and CI/CD\n");
        }

        if (repo.getStars() > 10 || repo.getForks() > 5) {
            sb.append("- **Community**: Gaining traction with ")
                    .append(repo.getStars()).append(" stars and ")
                    .append(repo.getForks()).append(" forks\n");
        }

        long daysSinceUpdate = TimeUtil.daysSince(repo.getUpdatedAt(), now);
        if (daysSinceUpdate > 90) {
            sb.append("- **Activity**: Repository appears inactive (last updated ")
                    .append(daysSinceUpdate).append(" days ago)\n");
        } else if (daysSinceUpdate < 7) {
            sb.append("- **Activity**: Actively maintained with recent updates\n");
        }
    }

    private static String lowerJoin(List<String> names, String separator) {
        return String.join(separator, names).toLowerCase(Locale.ROOT);
    }
}
