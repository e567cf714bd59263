package com.stone.orchestrator.engine;

import com.stone.orchestrator.forge.dto.IssueComment;
import com.stone.orchestrator.model.SpecificationScenario;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the specification comment from an issue body and reads requirements
 * back out of it.
 *
 * The comment is found again later by its marker heading; there is no other
 * record of it.
 */
public final class GherkinSpecification {

    public static final String MARKER = "## Gherkin Specification";

    private static final Pattern CRITERIA_HEADING = Pattern.compile(
            "^#{1,6}\\s*Acceptance Criteria\\s*:?\\s*$",
            Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    private static final Pattern ANY_HEADING = Pattern.compile("^#{1,6}\\s", Pattern.MULTILINE);
    private static final Pattern BULLET      = Pattern.compile("^\\s*[-*]\\s+(?:\\[[ xX]]\\s+)?(.+?)\\s*$");
    private static final Pattern SCENARIO    = Pattern.compile("Scenario:\\s+(.+?)\\s*$", Pattern.MULTILINE);

    private GherkinSpecification() {}

    /**
     * One scenario per bullet of the first Acceptance Criteria section, in
     * source order. Without such a section (or bullets in it) a single
     * generic scenario is returned.
     */
    public static List<SpecificationScenario> scenariosFor(String issueBody) {
        List<SpecificationScenario> scenarios = new ArrayList<>();
        acceptanceCriteria(issueBody).ifPresent(section -> {
            for (String line : section.lines().toList()) {
                Matcher bullet = BULLET.matcher(line);
                if (bullet.matches()) {
                    scenarios.add(fromCriterion(bullet.group(1)));
                }
            }
        });
        if (scenarios.isEmpty()) {
            scenarios.add(new SpecificationScenario(
                    "Successful implementation",
                    "the feature is implemented",
                    "the feature is used",
                    "it should work as expected"));
        }
        return scenarios;
    }

    static SpecificationScenario fromCriterion(String criterion) {
        return new SpecificationScenario(
                criterion,
                "the feature is being used",
                "the specific condition is met",
                criterion);
    }

    /** Text between the first Acceptance Criteria heading and the next heading. */
    static Optional<String> acceptanceCriteria(String body) {
        if (body == null) return Optional.empty();
        Matcher heading = CRITERIA_HEADING.matcher(body);
        if (!heading.find()) return Optional.empty();
        String rest = body.substring(heading.end());
        Matcher next = ANY_HEADING.matcher(rest);
        return Optional.of(next.find() ? rest.substring(0, next.start()) : rest);
    }

    /** Full comment body: marker, feature header, scenarios. */
    public static String render(String title, String issueBody, List<SpecificationScenario> scenarios) {
        String summary = issueBody == null || issueBody.isBlank()
                ? "Description not provided"
                : issueBody.lines().findFirst().orElse("").strip();
        StringBuilder sb = new StringBuilder();
        sb.append(MARKER).append("\n\n");
        sb.append("Feature: ").append(title).append('\n');
        sb.append("  ").append(summary).append("\n\n");
        for (int i = 0; i < scenarios.size(); i++) {
            if (i > 0) sb.append("\n\n");
            sb.append(scenarios.get(i).render());
        }
        sb.append("\n\nPlease review and adjust the specification as needed.");
        return sb.toString();
    }

    public static Optional<IssueComment> find(List<IssueComment> comments) {
        return comments.stream().filter(c -> c.contains(MARKER)).findFirst();
    }

    /** Every {@code Scenario:} line of a specification comment, in order, duplicates kept. */
    public static List<String> requirements(String specificationComment) {
        List<String> requirements = new ArrayList<>();
        Matcher m = SCENARIO.matcher(specificationComment);
        while (m.find()) {
            requirements.add(m.group(1));
        }
        return requirements;
    }
}
