package lab.relayer.common;

import jakarta.servlet.http.HttpServletRequest;
import lab.relayer.adapter.LedgerAdapterException;
import lab.relayer.adapter.TransactionRevertedException;
import lab.relayer.adapter.TransientLedgerException;
import lab.relayer.domain.escrow.ErrorCategory;
import lab.relayer.domain.escrow.EscrowException;
import lab.relayer.orchestration.OrderConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Pattern;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    // 32-byte hex values may be secrets or preimages
    private static final Pattern SENSITIVE_HEX_PATTERN = Pattern.compile("0x[a-fA-F0-9]{64,}");

    @ExceptionHandler(EscrowException.class)
    public ResponseEntity<ErrorResponse> handleEscrow(EscrowException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.getCategory());
        return respond(status, ex.getCategory().name(), ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(TransactionRevertedException.class)
    public ResponseEntity<ErrorResponse> handleReverted(TransactionRevertedException ex, HttpServletRequest request) {
        ErrorCategory category = ex.getErrorCode() == null ? ErrorCategory.STATE_CONFLICT : ex.getErrorCode().category();
        return respond(statusFor(category), category.name(), ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler({TransientLedgerException.class, LedgerAdapterException.class})
    public ResponseEntity<ErrorResponse> handleLedgerUnavailable(LedgerAdapterException ex, HttpServletRequest request) {
        log.warn("event=api.ledger_unavailable chain={} reason={}", ex.getChain(), ex.getMessage());
        return respond(HttpStatus.SERVICE_UNAVAILABLE, ErrorCategory.TRANSIENT_NETWORK.name(), ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(OrderConflictException.class)
    public ResponseEntity<ErrorResponse> handleConflict(OrderConflictException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, ErrorCategory.STATE_CONFLICT.name(), ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(NoSuchElementException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NoSuchElementException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "NOT_FOUND", ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<String> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .sorted()
                .toList();
        return respond(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION.name(), "Invalid order intent", violations, request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleBadRequest(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION.name(), ex.getMessage(), List.of(), request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        String detail = ex.getMostSpecificCause() != null ? ex.getMostSpecificCause().getMessage() : ex.getMessage();
        String message = "Invalid JSON body.";
        if (detail != null && !detail.isBlank()) {
            message += " Detail: " + detail;
        }
        ResponseEntity<ErrorResponse> response = respond(HttpStatus.BAD_REQUEST, ErrorCategory.VALIDATION.name(), message, List.of(), request);
        return ResponseEntity.badRequest()
                .header(HttpHeaders.CONTENT_TYPE, "application/json")
                .body(response.getBody());
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<ErrorResponse> handleRuntimeException(RuntimeException ex, HttpServletRequest request) {
        log.error("event=api.unexpected_error path={} reason={}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL", ex.getMessage(), List.of(), request);
    }

    static HttpStatus statusFor(ErrorCategory category) {
        return switch (category) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case AUTHORIZATION -> HttpStatus.FORBIDDEN;
            case STATE_CONFLICT -> HttpStatus.CONFLICT;
            case TIMING, PROTOCOL_VIOLATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TRANSIENT_NETWORK -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    private ResponseEntity<ErrorResponse> respond(
            HttpStatus status,
            String category,
            String message,
            List<String> details,
            HttpServletRequest request
    ) {
        ErrorResponse body = new ErrorResponse(
                status.value(),
                category,
                sanitizeMessage(message),
                details,
                request.getRequestURI()
        );
        return ResponseEntity.status(status).body(body);
    }

    static String sanitizeMessage(String message) {
        if (message == null || message.isBlank()) {
            return "Unexpected server error";
        }
        return SENSITIVE_HEX_PATTERN.matcher(message).replaceAll("0x[REDACTED]");
    }

    public record ErrorResponse(
            int status,
            String category,
            String message,
            List<String> details,
            String path
    ) {}
}
