package com.csd.repograder.service.scoring;

import com.csd.repograder.model.DimensionType;
import com.csd.repograder.model.ScoreDimension;

/**
 * Scores one quality dimension. Implementations are pure and never throw for absent optional fields.
 */
public interface DimensionScorer {

    DimensionType dimension();

    ScoreDimension score(ScoringContext context);
}
