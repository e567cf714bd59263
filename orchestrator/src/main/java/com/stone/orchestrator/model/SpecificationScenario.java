package com.stone.orchestrator.model;

/**
 * One requirement extracted from an issue's acceptance criteria, rendered
 * as a Given/When/Then scenario.
 */
public record SpecificationScenario(String title, String given, String when, String then) {

    /** Renders the scenario as an indented Gherkin block. */
    public String render() {
        return "  Scenario: " + title + "\n"
             + "    Given " + given + "\n"
             + "    When " + when + "\n"
             + "    Then " + then;
    }
}
