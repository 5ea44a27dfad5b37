package com.bko.racebuddy.plan.web;

import com.bko.racebuddy.plan.domain.InsufficientTimeException;
import com.bko.racebuddy.plan.domain.InvalidInputException;
import com.bko.racebuddy.plan.domain.PlanGenerationException;
import com.bko.racebuddy.plan.web.dto.ErrorResponseDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps planner failures to {@code {code, message}} bodies. A too-short timeline is 422, every
 * other rejected request is 400.
 */
@RestControllerAdvice(assignableTypes = PlanController.class)
public class PlanExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(PlanExceptionHandler.class);

    @ExceptionHandler(PlanGenerationException.class)
    public ResponseEntity<ErrorResponseDto> handlePlanGeneration(PlanGenerationException e) {
        logger.warn("Plan request rejected ({}): {}", e.getErrorCode(), e.getMessage());
        HttpStatus status = e instanceof InsufficientTimeException
                ? HttpStatus.UNPROCESSABLE_ENTITY
                : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(new ErrorResponseDto(e.getErrorCode(), e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalidArgument(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .sorted()
                .reduce((a, b) -> a + " " + b)
                .orElse("Request validation failed.");
        logger.warn("Plan request rejected ({}): {}", InvalidInputException.CODE, message);
        return ResponseEntity.badRequest().body(new ErrorResponseDto(InvalidInputException.CODE, message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponseDto> handleUnreadable(HttpMessageNotReadableException e) {
        logger.warn("Unreadable plan request: {}", e.getMessage());
        return ResponseEntity.badRequest()
                .body(new ErrorResponseDto("MALFORMED_REQUEST", "Request body could not be read."));
    }
}
