package com.github.crucibleplatform.orchestrator.api;

import com.github.crucibleplatform.orchestrator.domain.RejectionReason;
import com.github.crucibleplatform.orchestrator.service.InvalidEvaluationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * @author crucible-platform
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(InvalidEvaluationException.class)
    public ResponseEntity<ApiError> handleInvalidEvaluation(final InvalidEvaluationException e) {
        return ResponseEntity.badRequest().body(new ApiError(RejectionReason.VALIDATION.name(), e.getMessage(), false));
    }

    @ExceptionHandler(EvaluationNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(final EvaluationNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(new ApiError(ApiError.REASON_NOT_FOUND, e.getMessage(), false));
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ApiError> handleBadRequest(final Exception e) {
        log.debug("Bad request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ApiError(ApiError.REASON_BAD_REQUEST, e.getMessage(), false));
    }

}
