package com.reasonai.interfaces.api.dto;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.Map;

public record ReasoningRequest(
        @NotBlank(message = "Prompt is required")
        @Size(max = 8000, message = "Prompt must not exceed 8000 characters")
        String prompt,

        @Size(max = 16000, message = "Context must not exceed 16000 characters")
        String context,

        @Size(max = 20, message = "At most 20 constraints are allowed")
        List<@NotBlank(message = "Constraints must not be blank") String> constraints,

        Map<String, String> metadata,

        @Min(value = 1, message = "maxTokens must be at least 1")
        @Max(value = 4000, message = "maxTokens must not exceed 4000")
        Integer maxTokens,

        @DecimalMin(value = "0.0", message = "temperature must be at least 0")
        @DecimalMax(value = "2.0", message = "temperature must not exceed 2")
        Double temperature
) {}
