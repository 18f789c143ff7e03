package com.spatialnote.backend.api;

import com.spatialnote.backend.service.notebook.NotebookImportException;
import com.spatialnote.backend.service.workspace.WorkspaceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.stream.Collectors;

@RestControllerAdvice
public class ApiExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NoSuchElementException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleNotFound(NoSuchElementException e) {
        return Map.of(
                "error", "NOT_FOUND",
                "message", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException e) {
        return Map.of(
                "error", "BAD_REQUEST",
                "message", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return Map.of(
                "error", "VALIDATION_FAILED",
                "message", message
        );
    }

    @ExceptionHandler(NotebookImportException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleImport(NotebookImportException e) {
        return Map.of(
                "error", e.getKind().name(),
                "message", String.valueOf(e.getMessage())
        );
    }

    @ExceptionHandler(WorkspaceException.class)
    public ResponseEntity<Map<String, Object>> handleWorkspace(WorkspaceException e) {
        HttpStatus status = switch (e.getKind()) {
            case INVALID_NAME -> HttpStatus.BAD_REQUEST;
            case DUPLICATE_NAME -> HttpStatus.CONFLICT;
            case FILE_NOT_FOUND -> HttpStatus.NOT_FOUND;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        if (status.is5xxServerError()) log.error("workspace operation failed", e);
        return ResponseEntity.status(status).body(Map.of(
                "error", e.getKind().name(),
                "message", String.valueOf(e.getMessage())
        ));
    }
}
