package com.stone.orchestrator.classify;

import com.stone.orchestrator.model.FeedbackPriority;
import com.stone.orchestrator.model.FeedbackType;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Default keyword tables. Declared as beans so a deployment can override
 * either of them with a different {@link TextClassifier}.
 */
@Configuration
public class ClassifierConfig {

    @Bean
    public TextClassifier<FeedbackType> feedbackTypeClassifier() {
        return feedbackTypes();
    }

    @Bean
    public TextClassifier<FeedbackPriority> feedbackPriorityClassifier() {
        return feedbackPriorities();
    }

    public static TextClassifier<FeedbackType> feedbackTypes() {
        Map<FeedbackType, List<String>> rules = new LinkedHashMap<>();
        rules.put(FeedbackType.BUG,
                List.of("bug", "doesn't work", "does not work", "broken", "fix", "error"));
        rules.put(FeedbackType.ENHANCEMENT,
                List.of("feature request", "would be nice", "should add", "enhancement"));
        rules.put(FeedbackType.QUESTION,
                List.of("question", "how do", "why does", "clarify"));
        rules.put(FeedbackType.OTHER,
                List.of("feedback", "suggest", "improve", "should"));
        return new KeywordClassifier<>(rules, FeedbackType.OTHER);
    }

    public static TextClassifier<FeedbackPriority> feedbackPriorities() {
        Map<FeedbackPriority, List<String>> rules = new LinkedHashMap<>();
        rules.put(FeedbackPriority.HIGH,
                List.of("critical", "urgent", "blocker", "security", "crash", "broken", "error"));
        rules.put(FeedbackPriority.MEDIUM,
                List.of("important", "should", "needed", "bug"));
        return new KeywordClassifier<>(rules, FeedbackPriority.LOW);
    }
}
