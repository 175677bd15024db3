package com.csd.repograder.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class CommitRecord {
    String sha;
    String message;
    String authorName;
    Instant authorDate;
}
