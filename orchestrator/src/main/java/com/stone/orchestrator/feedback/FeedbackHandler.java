package com.stone.orchestrator.feedback;

import com.stone.orchestrator.classify.TextClassifier;
import com.stone.orchestrator.config.StoneProperties;
import com.stone.orchestrator.forge.ForgeClient;
import com.stone.orchestrator.forge.dto.IssueComment;
import com.stone.orchestrator.model.FeedbackItem;
import com.stone.orchestrator.model.FeedbackPriority;
import com.stone.orchestrator.model.FeedbackType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Turns reviewer comments on an issue's pull requests into a tracked
 * feedback issue and routes it to the teams whose areas it mentions.
 *
 * Classification goes through {@link TextClassifier}; the default keyword
 * tables live in {@code ClassifierConfig}.
 */
@Service
public class FeedbackHandler {

    private static final Logger log = LoggerFactory.getLogger(FeedbackHandler.class);

    static final String GENERAL_TEAM = "team-general";

    private final ForgeClient                      forge;
    private final StoneProperties                  properties;
    private final TextClassifier<FeedbackType>     typeClassifier;
    private final TextClassifier<FeedbackPriority> priorityClassifier;

    public FeedbackHandler(ForgeClient forge,
                           StoneProperties properties,
                           TextClassifier<FeedbackType> typeClassifier,
                           TextClassifier<FeedbackPriority> priorityClassifier) {
        this.forge              = forge;
        this.properties         = properties;
        this.typeClassifier     = typeClassifier;
        this.priorityClassifier = priorityClassifier;
    }

    // ------------------------------------------------------------------
    // Pipeline
    // ------------------------------------------------------------------

    /**
     * Collects feedback from every open pull request referencing the issue.
     *
     * @return the number of the feedback issue, empty when there was nothing to file
     */
    public Optional<Long> processFeedback(long issueNumber) {
        List<FeedbackItem> items = new ArrayList<>();
        for (long pr : forge.searchOpenPullRequestsReferencing(issueNumber)) {
            List<IssueComment> comments = new ArrayList<>(forge.listComments(pr));
            comments.addAll(forge.listPullRequestComments(pr));
            items.addAll(analyzePullRequestComments(pr, comments));
        }

        if (items.isEmpty()) {
            forge.createComment(issueNumber, """
                    ## Feedback Processing

                    No feedback found on pull requests referencing this issue.""");
            return Optional.empty();
        }

        List<FeedbackItem> prioritized = prioritizeFeedback(items);
        long feedbackIssue = generateFeedbackIssue(prioritized, issueNumber);
        routeFeedback(feedbackIssue, prioritized);

        forge.createComment(issueNumber, """
                ## Feedback Processing

                %d feedback item(s) collected and filed as #%d.""".formatted(prioritized.size(), feedbackIssue));
        forge.addLabels(issueNumber, List.of(properties.labels().feedbackProcessed()));
        log.info("Filed {} feedback item(s) from issue #{} as #{}", prioritized.size(), issueNumber, feedbackIssue);
        return Optional.of(feedbackIssue);
    }

    /**
     * Classifies each comment. Quoted lines ({@code > ...}) are not the
     * author's words and are dropped; a comment no type matches ("LGTM",
     * "thanks") carries no feedback and yields no item.
     */
    public List<FeedbackItem> analyzePullRequestComments(long pullRequest, List<IssueComment> comments) {
        List<FeedbackItem> items = new ArrayList<>();
        for (IssueComment comment : comments) {
            String content = stripQuotes(comment.body());
            Optional<FeedbackType> type = typeClassifier.match(content);
            if (type.isEmpty()) continue;
            items.add(new FeedbackItem(
                    type.get(),
                    content,
                    comment.authorLogin(),
                    priorityClassifier.fallback(),
                    pullRequest));
        }
        log.debug("Found {} feedback item(s) in PR #{}", items.size(), pullRequest);
        return items;
    }

    /** Assigns each item its priority and orders the list most urgent first, stable within a priority. */
    public List<FeedbackItem> prioritizeFeedback(List<FeedbackItem> items) {
        return items.stream()
                .map(item -> item.withPriority(priorityClassifier.classify(item.content())))
                .sorted(Comparator.comparing(FeedbackItem::priority))
                .toList();
    }

    /** Opens a new issue summarising the feedback, grouped by type. */
    public long generateFeedbackIssue(List<FeedbackItem> items, long sourceIssue) {
        FeedbackType mainType         = mainType(items);
        FeedbackPriority topPriority  = items.stream().map(FeedbackItem::priority)
                .min(Comparator.naturalOrder()).orElse(priorityClassifier.fallback());
        long pullRequest              = items.get(0).sourcePullRequest();

        String title = "Feedback: %s from PR #%d".formatted(mainType.label(), pullRequest);
        long number = forge.createIssue(title, renderBody(items, sourceIssue),
                List.of("feedback", "priority-" + topPriority.label(), mainType.label()));
        log.info("Created feedback issue #{} ({}, priority {})", number, mainType.label(), topPriority.label());
        return number;
    }

    /**
     * Labels the feedback issue for every configured team with an area
     * keyword in the feedback text, or for the general team when none match.
     */
    public List<String> routeFeedback(long feedbackIssue, List<FeedbackItem> items) {
        String text = items.stream().map(FeedbackItem::content)
                .collect(Collectors.joining("\n")).toLowerCase(Locale.ROOT);

        List<StoneProperties.Team> matched = properties.teams().stream()
                .filter(team -> team.areas().stream()
                        .anyMatch(area -> text.contains(area.toLowerCase(Locale.ROOT))))
                .toList();

        List<String> teamLabels = matched.isEmpty()
                ? List.of(GENERAL_TEAM)
                : matched.stream().map(team -> teamLabel(team.name())).toList();

        StringBuilder sb = new StringBuilder("## Feedback Routing\n\n");
        if (matched.isEmpty()) {
            sb.append("No team area matched this feedback; routed to the general team.");
        } else {
            sb.append("Routed to:\n");
            matched.forEach(team -> sb.append("- ").append(team.name())
                    .append(" (").append(String.join(", ", team.areas())).append(")\n"));
        }
        forge.createComment(feedbackIssue, sb.toString().stripTrailing());
        forge.addLabels(feedbackIssue, teamLabels);
        return teamLabels;
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    static String teamLabel(String teamName) {
        return "team-" + teamName.toLowerCase(Locale.ROOT).strip().replaceAll("\\s+", "-");
    }

    static String stripQuotes(String body) {
        if (body == null) return "";
        return body.lines()
                .filter(line -> !line.stripLeading().startsWith(">"))
                .collect(Collectors.joining("\n"))
                .strip();
    }

    /** Most frequent type; ties go to the type declared first. */
    static FeedbackType mainType(List<FeedbackItem> items) {
        Map<FeedbackType, Long> counts = items.stream()
                .collect(Collectors.groupingBy(FeedbackItem::type,
                        () -> new EnumMap<>(FeedbackType.class), Collectors.counting()));
        return counts.entrySet().stream()
                .max(Map.Entry.<FeedbackType, Long>comparingByValue()
                        .thenComparing(Map.Entry.<FeedbackType, Long>comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(FeedbackType.OTHER);
    }

    private static String renderBody(List<FeedbackItem> items, long sourceIssue) {
        Map<FeedbackType, List<FeedbackItem>> byType = items.stream()
                .collect(Collectors.groupingBy(FeedbackItem::type,
                        () -> new EnumMap<>(FeedbackType.class), Collectors.toList()));

        StringBuilder sb = new StringBuilder();
        sb.append("Feedback collected from pull request review for #").append(sourceIssue).append(".\n");
        byType.forEach((type, group) -> {
            sb.append("\n## ").append(capitalize(type.label())).append("\n");
            for (FeedbackItem item : group) {
                sb.append("\n### From @").append(item.author())
                  .append(" (priority: ").append(item.priority().label())
                  .append(", PR #").append(item.sourcePullRequest()).append(")\n\n")
                  .append(item.content()).append('\n');
            }
        });
        return sb.toString().stripTrailing();
    }

    private static String capitalize(String s) {
        return Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
