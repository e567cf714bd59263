package com.stone.orchestrator.git;

import java.util.List;

/**
 * Thrown when a git command exits non-zero, times out, or cannot be started.
 */
public class GitCommandException extends RuntimeException {

    private final List<String> command;
    private final int          exitCode;
    private final String       output;

    public GitCommandException(List<String> command, int exitCode, String output) {
        super("git " + String.join(" ", command) + " exited with " + exitCode + ": " + output.strip());
        this.command  = List.copyOf(command);
        this.exitCode = exitCode;
        this.output   = output;
    }

    public GitCommandException(List<String> command, String message, Throwable cause) {
        super("git " + String.join(" ", command) + " failed: " + message, cause);
        this.command  = List.copyOf(command);
        this.exitCode = -1;
        this.output   = "";
    }

    public List<String> command() { return command; }
    public int exitCode()         { return exitCode; }
    public String output()        { return output; }
}
