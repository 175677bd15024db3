package com.csd.repograder.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Complete report for one analyzed repository. Built once per analysis and never mutated.
 */
@Value
@Builder
public class AnalysisResult {
    String repositoryName;
    Map<DimensionType, ScoreDimension> scores; // ordered by DimensionType
    int overallScore;
    int maxScore;
    SkillLevel skillLevel;
    Tier tier;
    String summary;    // Markdown
    List<RoadmapItem> roadmap;
}
