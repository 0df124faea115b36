package com.finclinic.backend.exceptions;

import java.util.List;

import com.finclinic.backend.services.scoring.AnswerViolation;

public class AnswerValidationException extends BadRequestException {

    private final List<AnswerViolation> violations;

    public AnswerValidationException(List<AnswerViolation> violations) {
        super("Invalid assessment answers (" + violations.size() + " problem(s))");
        this.violations = List.copyOf(violations);
    }

    public List<AnswerViolation> getViolations() {
        return violations;
    }
}
