package com.csd.repograder.service.scoring;

import com.csd.repograder.model.CommitHistory;
import com.csd.repograder.model.RepositoryMetadata;
import com.csd.repograder.service.TimeUtil;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Inputs shared by every scorer for a single analysis. {@code now} is captured once per analysis.
 */
@Value
@Builder
public class ScoringContext {
    RepositoryMetadata metadata;
    CommitHistory history;
    Instant now;

    public long daysSince(Instant timestamp) {
        return TimeUtil.daysSince(timestamp, now);
    }
}
