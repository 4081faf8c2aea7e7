package tech.noetzold.waf_api.model;

import jakarta.validation.constraints.NotBlank;

public record ClassifyRequest(
        @NotBlank String message
) {}
