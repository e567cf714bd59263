package com.stone.orchestrator.forge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stone.orchestrator.config.StoneProperties;
import com.stone.orchestrator.forge.dto.*;
import com.stone.orchestrator.model.IssueSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * GitHub REST v3 adapter for {@link ForgeClient}.
 *
 * java.net.http plus Jackson, every header on the wire set explicitly.
 * Only the first page (100 entries) of list endpoints is read.
 */
@Component
public class GitHubForgeClient implements ForgeClient {

    private static final Logger log = LoggerFactory.getLogger(GitHubForgeClient.class);

    private static final String API_VERSION = "2022-11-28";
    private static final String PAGE        = "per_page=100";

    private static final TypeReference<List<IssueComment>>    COMMENTS = new TypeReference<>() {};
    private static final TypeReference<List<TimelineEvent>>   TIMELINE = new TypeReference<>() {};
    private static final TypeReference<List<PullRequestFile>> FILES    = new TypeReference<>() {};

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiUrl;
    private final String       repoPath;
    private final String       repoFullName;
    private final String       token;
    private final Duration     timeout;

    public GitHubForgeClient(StoneProperties properties, ObjectMapper objectMapper) {
        this.json         = objectMapper;
        this.apiUrl       = stripTrailingSlash(properties.forge().apiUrl());
        this.repoFullName = properties.repository().fullName();
        this.repoPath     = "/repos/" + repoFullName;
        this.token        = properties.forge().token();
        this.timeout      = properties.forge().requestTimeout();
        this.http         = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    // ------------------------------------------------------------------
    // Issues, comments, labels
    // ------------------------------------------------------------------

    @Override
    public IssueSnapshot getIssue(long issueNumber) {
        GitHubIssue issue = read(get(repoPath + "/issues/" + issueNumber), GitHubIssue.class);
        List<String> labels = issue.labels() == null ? List.of()
                : issue.labels().stream().map(GitHubLabel::name).filter(Objects::nonNull).toList();
        return new IssueSnapshot(
                issue.number(),
                issue.title(),
                issue.body(),
                "open".equals(issue.state()),
                labels,
                parseInstant(issue.created_at()),
                parseInstant(issue.closed_at()));
    }

    @Override
    public List<IssueComment> listComments(long issueNumber) {
        return read(get(repoPath + "/issues/" + issueNumber + "/comments?" + PAGE), COMMENTS);
    }

    @Override
    public void createComment(long issueNumber, String body) {
        log.debug("Commenting on #{} ({} chars)", issueNumber, body.length());
        send("POST", repoPath + "/issues/" + issueNumber + "/comments", Map.of("body", body));
    }

    @Override
    public void addLabels(long issueNumber, List<String> labels) {
        log.info("Adding labels {} to #{}", labels, issueNumber);
        send("POST", repoPath + "/issues/" + issueNumber + "/labels", Map.of("labels", labels));
    }

    @Override
    public void removeLabel(long issueNumber, String label) {
        log.info("Removing label '{}' from #{}", label, issueNumber);
        try {
            send("DELETE", repoPath + "/issues/" + issueNumber + "/labels/" + encode(label), null);
        } catch (ForgeException e) {
            if (!e.isNotFound()) {
                throw e;
            }
            log.debug("Label '{}' was not present on #{}", label, issueNumber);
        }
    }

    @Override
    public List<TimelineEvent> listTimeline(long issueNumber) {
        return read(get(repoPath + "/issues/" + issueNumber + "/timeline?" + PAGE), TIMELINE);
    }

    @Override
    public long createIssue(String title, String body, List<String> labels) {
        String resp = send("POST", repoPath + "/issues",
                Map.of("title", title, "body", body, "labels", labels));
        CreatedIssue created = read(resp, CreatedIssue.class);
        log.info("Created issue #{}", created.number());
        return created.number();
    }

    // ------------------------------------------------------------------
    // Pull requests and checks
    // ------------------------------------------------------------------

    @Override
    public PullRequest getPullRequest(long prNumber) {
        return read(get(repoPath + "/pulls/" + prNumber), PullRequest.class);
    }

    @Override
    public List<PullRequestFile> listPullRequestFiles(long prNumber) {
        return read(get(repoPath + "/pulls/" + prNumber + "/files?" + PAGE), FILES);
    }

    @Override
    public List<IssueComment> listPullRequestComments(long prNumber) {
        return read(get(repoPath + "/pulls/" + prNumber + "/comments?" + PAGE), COMMENTS);
    }

    @Override
    public List<CheckRun> listCheckRuns(String ref) {
        CheckRunList list = read(get(repoPath + "/commits/" + encodePath(ref) + "/check-runs?" + PAGE),
                CheckRunList.class);
        return list.check_runs() == null ? List.of() : list.check_runs();
    }

    @Override
    public List<Long> searchOpenPullRequestsReferencing(long issueNumber) {
        String query = "repo:" + repoFullName + " is:pr is:open " + issueNumber + " in:body";
        SearchResult result = read(get("/search/issues?q=" + encode(query)), SearchResult.class);
        if (result.items() == null) return List.of();
        return result.items().stream()
                .filter(SearchResult.Item::isPullRequest)
                .map(SearchResult.Item::number)
                .toList();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String get(String path) {
        return send("GET", path, null);
    }

    /** Sends one request; returns the body of a 2xx response. */
    private String send(String method, String path, Object payload) {
        try {
            HttpRequest.BodyPublisher publisher = payload == null
                    ? HttpRequest.BodyPublishers.noBody()
                    : HttpRequest.BodyPublishers.ofString(json.writeValueAsString(payload));
            HttpRequest.Builder req = HttpRequest.newBuilder()
                    .uri(URI.create(apiUrl + path))
                    .timeout(timeout)
                    .header("Accept",               "application/vnd.github+json")
                    .header("X-GitHub-Api-Version", API_VERSION)
                    .method(method, publisher);
            if (payload != null) {
                req.header("Content-Type", "application/json");
            }
            if (!token.isBlank()) {
                req.header("Authorization", "Bearer " + token);
            }
            HttpResponse<String> resp = http.send(req.build(), HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ForgeException(
                        method + " " + path + " failed: HTTP " + resp.statusCode() + ": " + resp.body(),
                        resp.statusCode());
            }
            return resp.body();
        } catch (ForgeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ForgeException(method + " " + path + " interrupted", e);
        } catch (Exception e) {
            throw new ForgeException(method + " " + path + " failed", e);
        }
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ForgeException("Malformed forge response for " + type.getSimpleName(), e);
        }
    }

    private <T> T read(String body, TypeReference<T> type) {
        try {
            return json.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ForgeException("Malformed forge response", e);
        }
    }

    private static Instant parseInstant(String value) {
        return value == null || value.isBlank() ? null : Instant.parse(value);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /** Like encode() but keeps '/' so branch names stay addressable. */
    private static String encodePath(String value) {
        return encode(value).replace("%2F", "/");
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
