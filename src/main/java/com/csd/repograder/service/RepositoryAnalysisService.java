package com.csd.repograder.service;

import com.csd.repograder.model.AnalysisResult;
import com.csd.repograder.model.CommitHistory;
import com.csd.repograder.model.RepositoryIdentifier;
import com.csd.repograder.model.RepositoryMetadata;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Entry point for a full analysis: resolve the identifier, fetch from GitHub, then score.
 */
@Slf4j
@Service
public class RepositoryAnalysisService {

    private final RepositoryUrlParser urlParser;
    private final GitHubRepositoryFetcher fetcher;
    private final RepositoryAnalyzer analyzer;

    public RepositoryAnalysisService(RepositoryUrlParser urlParser,
                                     GitHubRepositoryFetcher fetcher,
                                     RepositoryAnalyzer analyzer) {
        this.urlParser = urlParser;
        this.fetcher = fetcher;
        this.analyzer = analyzer;
    }

    public AnalysisResult analyzeUrl(String url) {
        return analyze(urlParser.parse(url));
    }

    public AnalysisResult analyze(String owner, String repository) {
        return analyze(urlParser.parse("https://github.com/" + owner + "/" + repository));
    }

    private AnalysisResult analyze(RepositoryIdentifier id) {
        log.info("=== Starting analysis for repository: {} ===", id);
        RepositoryMetadata metadata = fetcher.fetchRepository(id);
        CommitHistory history = fetcher.fetchCommitHistory(id);
        log.info("Fetched {} with {} sampled commits", id, history.getCommits().size());
        return analyzer.analyze(metadata, history, id.toString());
    }
}
