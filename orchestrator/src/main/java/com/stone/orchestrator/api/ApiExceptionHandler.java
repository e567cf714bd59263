package com.stone.orchestrator.api;

import com.stone.orchestrator.api.dto.ErrorResponse;
import com.stone.orchestrator.conflict.ConflictResolutionException;
import com.stone.orchestrator.forge.ForgeException;
import com.stone.orchestrator.git.GitCommandException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps collaborator failures onto HTTP statuses. A missing issue is 404;
 * every other forge or git failure is the upstream's fault, so 502.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ForgeException.class)
    public ResponseEntity<ErrorResponse> forge(ForgeException e) {
        HttpStatus status = e.isNotFound() ? HttpStatus.NOT_FOUND : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status).body(new ErrorResponse("forge", e.getMessage()));
    }

    @ExceptionHandler(GitCommandException.class)
    public ResponseEntity<ErrorResponse> git(GitCommandException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse("git", e.getMessage()));
    }

    @ExceptionHandler(ConflictResolutionException.class)
    public ResponseEntity<ErrorResponse> conflict(ConflictResolutionException e) {
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(new ErrorResponse("conflict", e.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("request", e.getMessage()));
    }
}
