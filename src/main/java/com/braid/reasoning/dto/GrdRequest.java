package com.braid.reasoning.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request body carrying GRD text: raw flowchart source or markdown with a mermaid fence.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GrdRequest {

    @NotNull(message = "text is required")
    private String text;
}
