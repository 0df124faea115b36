package com.finclinic.backend.dto.assessment;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record ProfileRequestDTO(

        // label ("30K-40K") or constant name; optional
        String incomeBracket,

        @NotBlank(message = "nationality is required")
        String nationality,

        @NotBlank(message = "gender is required")
        String gender,

        @NotNull(message = "dependents is required")
        @Min(value = 0, message = "dependents must be zero or more")
        Integer dependents
) {}
