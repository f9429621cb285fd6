package com.comicguess.dailypuzzle.exception;

import io.jsonwebtoken.JwtException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders gameplay failures as {ok, status, error, message, path, timestamp}
 */
@Slf4j
@RestControllerAdvice
public class GameplayExceptionAdvice {

    @ExceptionHandler(EmptyPoolException.class)
    public ResponseEntity<Map<String, Object>> handleEmptyPool(EmptyPoolException e, HttpServletRequest req) {
        log.error("[{}] {}", req.getRequestURI(), e.getMessage());
        return body(HttpStatus.INTERNAL_SERVER_ERROR, e.getErrorCode(), e.getMessage(), req);
    }

    @ExceptionHandler(GameplayException.class)
    public ResponseEntity<Map<String, Object>> handleGameplay(GameplayException e, HttpServletRequest req) {
        HttpStatus status = statusFor(e.getErrorCode());
        log.debug("[{}] {} -> {}", req.getRequestURI(), e.getErrorCode(), status.value());
        return body(status, e.getErrorCode(), e.getMessage(), req);
    }

    @ExceptionHandler(JwtException.class)
    public ResponseEntity<Map<String, Object>> handleJwt(JwtException e, HttpServletRequest req) {
        log.debug("[{}] rejected token: {}", req.getRequestURI(), e.getMessage());
        return body(HttpStatus.UNAUTHORIZED, "unauthenticated", "Invalid or expired token", req);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, "invalid_request", "Request body is missing or malformed", req);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<Map<String, Object>> handleMissingParameter(MissingServletRequestParameterException e,
                                                                      HttpServletRequest req) {
        return body(HttpStatus.BAD_REQUEST, "invalid_request",
                "Missing request parameter '" + e.getParameterName() + "'", req);
    }

    @ExceptionHandler({
            TransientDataAccessException.class,
            DataAccessResourceFailureException.class,
            CannotCreateTransactionException.class
    })
    public ResponseEntity<Map<String, Object>> handleUnavailable(RuntimeException e, HttpServletRequest req) {
        log.error("[{}] repository unavailable: {}", req.getRequestURI(), e.getMessage(), e);
        return body(HttpStatus.SERVICE_UNAVAILABLE, "repository_unavailable",
                "Storage is temporarily unavailable, retry later", req);
    }

    static HttpStatus statusFor(String errorCode) {
        switch (errorCode) {
            case "invalid_universe":
            case "invalid_guess":
            case "invalid_puzzle_id":
            case "invalid_date":
                return HttpStatus.BAD_REQUEST;
            case "unauthenticated":
                return HttpStatus.UNAUTHORIZED;
            case "user_not_found":
            case "puzzle_not_found":
                return HttpStatus.NOT_FOUND;
            case "already_solved":
            case "attempts_exhausted":
            case "concurrent_guess":
                return HttpStatus.CONFLICT;
            default:
                return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, String message,
                                                             HttpServletRequest req) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("ok", false);
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", message);
        body.put("path", req.getRequestURI());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
