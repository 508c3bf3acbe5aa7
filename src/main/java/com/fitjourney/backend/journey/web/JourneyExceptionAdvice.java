package com.fitjourney.backend.journey.web;

import com.fitjourney.backend.common.web.RequestIdFilter;
import com.fitjourney.backend.journey.controller.JourneyController;
import com.fitjourney.backend.journey.dto.JourneyErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice(assignableTypes = JourneyController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class JourneyExceptionAdvice {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<JourneyErrorResponse> handleIllegalArg(IllegalArgumentException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "BAD_REQUEST");
        HttpStatus status = switch (code) {
            case "TASK_NOT_FOUND", "STAGE_NOT_FOUND" -> HttpStatus.NOT_FOUND;
            default -> HttpStatus.BAD_REQUEST;
        };
        return ResponseEntity.status(status).body(err(code, e, req));
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<JourneyErrorResponse> handleIllegalState(IllegalStateException e, HttpServletRequest req) {
        String code = norm(e.getMessage(), "ILLEGAL_STATE");
        HttpStatus status = switch (code) {
            case "STAGE_LOCKED" -> HttpStatus.FORBIDDEN;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
        return ResponseEntity.status(status).body(err(code, e, req));
    }

    /** ✅ @Valid 失敗：message 直接放 code（例如 CONDITIONS_REQUIRED） */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<JourneyErrorResponse> handleInvalid(MethodArgumentNotValidException e, HttpServletRequest req) {
        String code = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getDefaultMessage())
                .filter(m -> m != null && !m.isBlank())
                .findFirst()
                .orElse("VALIDATION_FAILED");
        return ResponseEntity.badRequest().body(new JourneyErrorResponse(code, code, RequestIdFilter.currentOrNull(req)));
    }

    private static JourneyErrorResponse err(String code, Exception e, HttpServletRequest req) {
        return new JourneyErrorResponse(code, norm(e.getMessage(), code), RequestIdFilter.currentOrNull(req));
    }

    private static String norm(String s, String dft) {
        if (s == null) return dft;
        String v = s.trim();
        return v.isEmpty() ? dft : v;
    }
}
