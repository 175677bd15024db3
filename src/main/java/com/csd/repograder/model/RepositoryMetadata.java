package com.csd.repograder.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Snapshot of the repository metadata the scorers work from.
 * Optional fields are null when the hosting provider has no value for them.
 */
@Value
public class RepositoryMetadata {
    String name;
    String description;   // optional
    String language;      // optional, primary language
    Map<String, Long> languages; // copied, insertion order kept
    int stars;
    int forks;
    int openIssues;
    long size;
    Instant createdAt;
    Instant updatedAt;
    Instant pushedAt;
    boolean wikiEnabled;
    boolean issuesEnabled;
    boolean projectsEnabled;
    LicenseInfo license;  // optional
    String readme;        // optional, full README text
    String defaultBranch; // optional

    @Builder
    public RepositoryMetadata(String name, String description, String language, Map<String, Long> languages,
                              int stars, int forks, int openIssues, long size,
                              Instant createdAt, Instant updatedAt, Instant pushedAt,
                              boolean wikiEnabled, boolean issuesEnabled, boolean projectsEnabled,
                              LicenseInfo license, String readme, String defaultBranch) {
        this.name = name;
        this.description = description;
        this.language = language;
        this.languages = languages == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(languages));
        this.stars = stars;
        this.forks = forks;
        this.openIssues = openIssues;
        this.size = size;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.pushedAt = pushedAt;
        this.wikiEnabled = wikiEnabled;
        this.issuesEnabled = issuesEnabled;
        this.projectsEnabled = projectsEnabled;
        this.license = license;
        this.readme = readme;
        this.defaultBranch = defaultBranch;
    }

    public boolean hasReadme() {
        return readme != null && !readme.isEmpty();
    }

    public boolean hasLicense() {
        return license != null;
    }
}
