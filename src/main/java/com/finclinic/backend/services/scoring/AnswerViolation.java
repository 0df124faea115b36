package com.finclinic.backend.services.scoring;

public record AnswerViolation(String questionId, Type type, String message) {

    public enum Type {
        MISSING_ANSWER,
        INVALID_VALUE
    }

    static AnswerViolation missing(String questionId, int number) {
        return new AnswerViolation(questionId, Type.MISSING_ANSWER,
                "Missing answer for question " + number + " (" + questionId + ")");
    }

    static AnswerViolation invalid(String questionId, Object value) {
        return new AnswerViolation(questionId, Type.INVALID_VALUE,
                "Invalid answer value " + describe(value) + " for " + questionId + ". Must be an integer 1-5.");
    }

    private static String describe(Object value) {
        return value instanceof String text ? "\"" + text + "\"" : String.valueOf(value);
    }
}
