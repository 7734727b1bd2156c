package com.braid.reasoning.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Error body for rejected requests. Optional fields are omitted when not applicable.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    private String error;           // taxonomy name, e.g. SyntaxError, CycleError
    private String message;
    private Integer line;           // 1-based source line for syntax errors
    private String rawLine;
    private List<String> cycle;
}
