package com.stone.orchestrator.model;

import java.util.List;

public record ImplementationVerification(boolean success, List<String> missingRequirements) {

    public ImplementationVerification {
        missingRequirements = List.copyOf(missingRequirements);
    }
}
