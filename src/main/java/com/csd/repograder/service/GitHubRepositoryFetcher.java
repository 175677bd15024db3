package com.csd.repograder.service;

import com.csd.repograder.exception.FetchFailedException;
import com.csd.repograder.exception.RateLimitedException;
import com.csd.repograder.exception.RepositoryAnalysisException;
import com.csd.repograder.exception.RepositoryNotFoundException;
import com.csd.repograder.model.CommitHistory;
import com.csd.repograder.model.CommitRecord;
import com.csd.repograder.model.LicenseInfo;
import com.csd.repograder.model.RepositoryIdentifier;
import com.csd.repograder.model.RepositoryMetadata;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads repository metadata, README, language breakdown and recent commits from the GitHub REST API.
 */
@Slf4j
@Service
public class GitHubRepositoryFetcher {

    private static final String RAW_MEDIA_TYPE = "application/vnd.github.raw";
    private static final List<String> REQUIRED_REPO_FIELDS = List.of("name", "created_at", "updated_at", "pushed_at");

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String token;
    private final int commitPageSize;

    public GitHubRepositoryFetcher(ObjectMapper mapper,
                                   @Value("${github.api.base-url:https://api.github.com}") String baseUrl,
                                   @Value("${github.token:}") String token,
                                   @Value("${github.timeout-seconds:10}") int timeoutSeconds,
                                   @Value("${github.commit-page-size:100}") int commitPageSize) {
        this.client = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofSeconds(timeoutSeconds))
                .readTimeout(Duration.ofSeconds(timeoutSeconds))
                .callTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.token = token;
        this.commitPageSize = commitPageSize;
    }

    /**
     * Fetches the repository record and enriches it with README text and language byte counts.
     *
     * @throws RepositoryNotFoundException when GitHub answers 404
     * @throws RateLimitedException when GitHub answers 403
     * @throws FetchFailedException on any other failure
     */
    public RepositoryMetadata fetchRepository(RepositoryIdentifier id) {
        String repoUrl = repoUrl(id);
        JsonNode repoRoot;
        try (Response response = client.newCall(request(repoUrl, null)).execute()) {
            if (!response.isSuccessful()) {
                log.warn("GitHub returned {} for {}", response.code(), id);
                throw errorForStatus(response.code());
            }
            repoRoot = mapper.readTree(bodyText(response));
        } catch (IOException e) {
            throw new FetchFailedException("Failed to fetch repository data", e);
        }

        String readme = fetchReadme(id);
        Map<String, Long> languages = fetchLanguages(id);
        try {
            return toMetadata(repoRoot, readme, languages);
        } catch (DateTimeParseException e) {
            throw new FetchFailedException("Failed to fetch repository data", e);
        }
    }

    /**
     * Fetches the newest commits. Any failure yields an empty history rather than an error.
     */
    public CommitHistory fetchCommitHistory(RepositoryIdentifier id) {
        String commitsUrl = repoUrl(id) + "/commits?per_page=" + commitPageSize;
        try (Response response = client.newCall(request(commitsUrl, null)).execute()) {
            if (!response.isSuccessful()) {
                log.warn("Commit listing for {} returned {}", id, response.code());
                return CommitHistory.empty();
            }
            return toCommitHistory(mapper.readTree(bodyText(response)));
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to fetch commits for {}: {}", id, e.getMessage());
            return CommitHistory.empty();
        }
    }

    String fetchReadme(RepositoryIdentifier id) {
        try (Response response = client.newCall(request(repoUrl(id) + "/readme", RAW_MEDIA_TYPE)).execute()) {
            if (!response.isSuccessful()) {
                log.debug("No README for {} ({})", id, response.code());
                return null;
            }
            return bodyText(response);
        } catch (IOException e) {
            log.warn("Failed to fetch README for {}: {}", id, e.getMessage());
            return null;
        }
    }

    Map<String, Long> fetchLanguages(RepositoryIdentifier id) {
        try (Response response = client.newCall(request(repoUrl(id) + "/languages", null)).execute()) {
            if (!response.isSuccessful()) {
                log.debug("No language breakdown for {} ({})", id, response.code());
                return Map.of();
            }
            return toLanguages(mapper.readTree(bodyText(response)));
        } catch (IOException e) {
            log.warn("Failed to fetch languages for {}: {}", id, e.getMessage());
            return Map.of();
        }
    }

    static RepositoryAnalysisException errorForStatus(int status) {
        if (status == 404) {
            return new RepositoryNotFoundException(
                    "Repository not found. Please check the URL and ensure the repository is public.");
        }
        if (status == 403) {
            return new RateLimitedException("API rate limit exceeded. Please try again later.");
        }
        return new FetchFailedException("Failed to fetch repository data");
    }

    /**
     * @throws FetchFailedException when the payload lacks the name or any of the three timestamps
     */
    static RepositoryMetadata toMetadata(JsonNode root, String readme, Map<String, Long> languages) {
        for (String field : REQUIRED_REPO_FIELDS) {
            if (text(root, field) == null) {
                log.warn("GitHub repository payload has no '{}'", field);
                throw new FetchFailedException("Incomplete repository data from GitHub: missing " + field);
            }
        }

        JsonNode licenseNode = root.get("license");
        LicenseInfo license = null;
        if (licenseNode != null && licenseNode.isObject()) {
            license = LicenseInfo.builder()
                    .name(text(licenseNode, "name"))
                    .url(text(licenseNode, "url"))
                    .build();
        }

        return RepositoryMetadata.builder()
                .name(text(root, "name"))
                .description(text(root, "description"))
                .language(text(root, "language"))
                .languages(languages)
                .stars(root.path("stargazers_count").asInt())
                .forks(root.path("forks_count").asInt())
                .openIssues(root.path("open_issues_count").asInt())
                .size(root.path("size").asLong())
                .createdAt(instant(root, "created_at"))
                .updatedAt(instant(root, "updated_at"))
                .pushedAt(instant(root, "pushed_at"))
                .wikiEnabled(root.path("has_wiki").asBoolean())
                .issuesEnabled(root.path("has_issues").asBoolean())
                .projectsEnabled(root.path("has_projects").asBoolean())
                .license(license)
                .readme(readme)
                .defaultBranch(text(root, "default_branch"))
                .build();
    }

    static Map<String, Long> toLanguages(JsonNode root) {
        Map<String, Long> languages = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            languages.put(field.getKey(), field.getValue().asLong());
        }
        return languages;
    }

    static CommitHistory toCommitHistory(JsonNode root) {
        if (root == null || !root.isArray()) {
            return CommitHistory.empty();
        }
        List<CommitRecord> commits = new ArrayList<>();
        for (JsonNode node : root) {
            JsonNode commit = node.path("commit");
            JsonNode author = commit.path("author");
            if (text(author, "date") == null) {
                log.debug("Skipping commit {} without an author date", text(node, "sha"));
                continue;
            }
            commits.add(CommitRecord.builder()
                    .sha(text(node, "sha"))
                    .message(commit.path("message").asText(""))
                    .authorName(text(author, "name"))
                    .authorDate(instant(author, "date"))
                    .build());
        }
        // the listing is one page, so its length stands in for the total
        return CommitHistory.builder()
                .totalCount(commits.size())
                .commits(List.copyOf(commits))
                .build();
    }

    private Request request(String url, String accept) {
        Request.Builder builder = new Request.Builder()
                .url(url)
                .header("Accept", accept != null ? accept : "application/vnd.github+json");
        if (token != null && !token.isEmpty()) {
            builder.header("Authorization", "token " + token);
        }
        return builder.build();
    }

    private String repoUrl(RepositoryIdentifier id) {
        return String.format("%s/repos/%s/%s", baseUrl, id.getOwner(), id.getRepository());
    }

    private static String bodyText(Response response) throws IOException {
        ResponseBody body = response.body();
        return body == null ? "" : body.string();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static Instant instant(JsonNode node, String field) {
        String value = text(node, field);
        return value == null ? null : Instant.parse(value);
    }
}
