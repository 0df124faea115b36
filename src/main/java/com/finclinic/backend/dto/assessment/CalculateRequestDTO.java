package com.finclinic.backend.dto.assessment;

import java.util.Map;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record CalculateRequestDTO(

        String catalogRevision,

        // raw JSON values; typed checks happen in scoring so every bad answer is reported
        @NotNull(message = "answers are required")
        Map<String, Object> answers,

        @NotNull(message = "profile is required")
        @Valid
        ProfileRequestDTO profile
) {}
