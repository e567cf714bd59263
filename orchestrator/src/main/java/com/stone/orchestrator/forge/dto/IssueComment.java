package com.stone.orchestrator.forge.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An issue comment or a pull request review comment; both share this shape.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IssueComment(long id, String body, GitHubUser user, String created_at) {

    public String authorLogin() {
        return user == null || user.login() == null ? "unknown" : user.login();
    }

    public boolean contains(String text) {
        return body != null && body.contains(text);
    }
}
