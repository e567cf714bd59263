package com.stone.orchestrator.conflict;

/**
 * Thrown when a resolution attempt fails for an operational reason, such as
 * a failed git command. Conflicts that simply cannot be resolved
 * automatically are reported as a failed result instead; forge failures
 * propagate unwrapped.
 */
public class ConflictResolutionException extends RuntimeException {

    public ConflictResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
