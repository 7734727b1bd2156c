package com.braid.reasoning.dto;

import com.braid.reasoning.service.prompt.GrdExample;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PromptRequest {

    @NotBlank(message = "problem is required")
    private String problem;

    @Builder.Default
    private List<GrdExample> examples = new ArrayList<>();
}
