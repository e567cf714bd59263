package com.stone.orchestrator.model;

/** Declared highest first, so natural ordering sorts by urgency. */
public enum FeedbackPriority {
    HIGH,
    MEDIUM,
    LOW;

    public String label() {
        return name().toLowerCase();
    }
}
