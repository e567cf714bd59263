package com.stone.orchestrator;

import com.stone.orchestrator.config.StoneProperties;

import java.time.Duration;
import java.util.List;

/** Same values application.yml binds by default, for tests that build beans by hand. */
public final class TestProperties {

    private TestProperties() {}

    public static StoneProperties defaults() {
        return build("prefer-feature", "https://api.github.com");
    }

    public static StoneProperties withStrategy(String strategy) {
        return build(strategy, "https://api.github.com");
    }

    public static StoneProperties withApiUrl(String apiUrl) {
        return build("prefer-feature", apiUrl);
    }

    public static StoneProperties.Labels labels() {
        return new StoneProperties.Labels(
                "stone-process", "stone-pm", "stone-qa", "stone-feature-implement", "stone-audit",
                "stone-conflict", "stone-ready-for-tests", "stone-docs", "stone-pr", "stone-complete",
                "stone-error", "stone-audit-failed", "stone-conflicts-resolved",
                "stone-manual-resolution-needed", "stone-feedback-processed");
    }

    private static StoneProperties build(String strategy, String apiUrl) {
        return new StoneProperties(
                new StoneProperties.Repository("acme", "widgets", ".", ""),
                new StoneProperties.Forge(apiUrl, "test-token", Duration.ofSeconds(5)),
                labels(),
                new StoneProperties.Audit(80, 1, 20, List.of(".java", ".kt", ".ts", ".js", ".py", ".go")),
                new StoneProperties.Branches("main", "stone/"),
                new StoneProperties.Conflicts(strategy, Duration.ofSeconds(30)),
                List.of(
                        new StoneProperties.Team("Frontend", List.of("ui", "css")),
                        new StoneProperties.Team("Backend", List.of("api", "database"))));
    }
}
