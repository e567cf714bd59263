package com.stone.orchestrator.model;

public enum FeedbackType {
    BUG,
    ENHANCEMENT,
    QUESTION,
    OTHER;

    public String label() {
        return name().toLowerCase();
    }
}
