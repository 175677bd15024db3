package com.csd.repograder.service;

import com.csd.repograder.exception.InvalidInputException;
import com.csd.repograder.model.RepositoryIdentifier;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class RepositoryUrlParser {

    private static final Pattern GITHUB_URL = Pattern.compile("github\\.com/([^/]+)/([^/]+)/?$");

    /**
     * Extracts owner and repository from a URL such as {@code https://github.com/owner/repo.git}.
     */
    public RepositoryIdentifier parse(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidInputException("Invalid GitHub repository URL");
        }
        Matcher matcher = GITHUB_URL.matcher(url.trim());
        if (!matcher.find()) {
            throw new InvalidInputException("Invalid GitHub repository URL");
        }
        String repository = matcher.group(2);
        if (repository.endsWith(".git")) {
            repository = repository.substring(0, repository.length() - ".git".length());
        }
        if (repository.isEmpty()) {
            throw new InvalidInputException("Invalid GitHub repository URL");
        }
        return RepositoryIdentifier.builder()
                .owner(matcher.group(1))
                .repository(repository)
                .build();
    }
}
