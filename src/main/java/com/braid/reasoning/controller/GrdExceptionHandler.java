package com.braid.reasoning.controller;

import com.braid.reasoning.dto.ErrorResponse;
import com.braid.reasoning.exception.CycleException;
import com.braid.reasoning.exception.FlowchartSyntaxException;
import com.braid.reasoning.exception.GrdException;
import com.braid.reasoning.exception.MermaidExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps GRD failures to HTTP responses: missing diagram -> 404, malformed diagram -> 422,
 * malformed request -> 400.
 */
@RestControllerAdvice
@Slf4j
public class GrdExceptionHandler {

    @ExceptionHandler(MermaidExtractionException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(MermaidExtractionException ex) {
        return new ResponseEntity<>(base(ex).build(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(FlowchartSyntaxException.class)
    public ResponseEntity<ErrorResponse> handleSyntax(FlowchartSyntaxException ex) {
        ErrorResponse body = base(ex)
                .line(ex.getLineNumber())
                .rawLine(ex.getLine())
                .build();
        return new ResponseEntity<>(body, HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(CycleException.class)
    public ResponseEntity<ErrorResponse> handleCycle(CycleException ex) {
        return new ResponseEntity<>(base(ex).cycle(ex.getCycle()).build(), HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(GrdException.class)
    public ResponseEntity<ErrorResponse> handleStructure(GrdException ex) {
        return new ResponseEntity<>(base(ex).build(), HttpStatus.UNPROCESSABLE_ENTITY);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidRequest(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.debug("Rejected request: {}", message);
        ErrorResponse body = ErrorResponse.builder()
                .error("InvalidRequest")
                .message(message)
                .build();
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
        log.debug("Unreadable request body: {}", ex.getMessage());
        ErrorResponse body = ErrorResponse.builder()
                .error("InvalidRequest")
                .message("Request body is missing or not valid JSON")
                .build();
        return ResponseEntity.badRequest().body(body);
    }

    private ErrorResponse.ErrorResponseBuilder base(GrdException ex) {
        return ErrorResponse.builder()
                .error(ex.errorType())
                .message(ex.getMessage());
    }
}
