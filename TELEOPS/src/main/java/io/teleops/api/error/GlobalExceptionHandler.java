package io.teleops.api.error;

import io.teleops.domain.service.IncidentNotFoundException;
import io.teleops.rca.InvalidRuleTableException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    public static final String CORRELATION_HEADER = "X-Correlation-Id";

    private final Clock clock;

    public GlobalExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    private ApiError build(ErrorCode code, String msg, String cid, Map<String, Object> details) {
        return new ApiError(clock.instant(), code, msg, cid, details);
    }

    private String cid(ServerWebExchange exchange) {
        return exchange.getRequest().getHeaders().getFirst(CORRELATION_HEADER);
    }

    @ExceptionHandler(IncidentNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(IncidentNotFoundException ex, ServerWebExchange exchange) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ErrorCode.INCIDENT_NOT_FOUND, ex.getMessage(), cid(exchange),
                        Map.of("incident_id", ex.getIncidentId())));
    }

    @ExceptionHandler(InvalidRuleTableException.class)
    public ResponseEntity<ApiError> handleInvalidRuleTable(InvalidRuleTableException ex,
                                                           ServerWebExchange exchange) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.INVALID_RULE_TABLE, ex.getMessage(), cid(exchange), Map.of()));
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ApiError> handleValidation(WebExchangeBindException ex, ServerWebExchange exchange) {
        List<String> fieldErrors = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .toList();
        return ResponseEntity.badRequest().body(
                build(ErrorCode.VALIDATION_FAILED, "Validation error", cid(exchange),
                        Map.of("field_errors", fieldErrors)));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> handleInput(ServerWebInputException ex, ServerWebExchange exchange) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, ex.getReason(), cid(exchange), Map.of()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArg(IllegalArgumentException ex, ServerWebExchange exchange) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), cid(exchange), Map.of()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex, ServerWebExchange exchange) {
        log.error("Unhandled error on {}", exchange.getRequest().getPath(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), cid(exchange), Map.of()));
    }
}
