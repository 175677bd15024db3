package com.csd.repograder.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Sampled commit history, newest commit first.
 */
@Value
public class CommitHistory {
    int totalCount;
    List<CommitRecord> commits;

    @Builder
    public CommitHistory(int totalCount, List<CommitRecord> commits) {
        this.totalCount = totalCount;
        this.commits = commits == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(commits));
    }

    public static CommitHistory empty() {
        return CommitHistory.builder().totalCount(0).commits(List.of()).build();
    }
}
