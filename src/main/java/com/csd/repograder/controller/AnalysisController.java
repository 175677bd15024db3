package com.csd.repograder.controller;

import com.csd.repograder.model.AnalysisResult;
import com.csd.repograder.service.RepositoryAnalysisService;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api")
@Slf4j
public class AnalysisController {

    private final RepositoryAnalysisService analysisService;

    public AnalysisController(RepositoryAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping("/analyze")
    public AnalysisResult analyze(@RequestBody AnalyzeRequest request) {
        log.info("Analyze request: url={}", request.getUrl());
        return analysisService.analyzeUrl(request.getUrl());
    }

    @GetMapping("/analyze/{owner}/{repo}")
    public AnalysisResult analyze(@PathVariable String owner, @PathVariable String repo) {
        log.info("Analyze request: {}/{}", owner, repo);
        return analysisService.analyze(owner, repo);
    }

    @Data
    public static class AnalyzeRequest {
        private String url;
    }
}
