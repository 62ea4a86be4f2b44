package com.ciro.jcss.extract;

public record ValidationResult(boolean valid, String message) {

    public static final String VALID_MESSAGE = "CSS is valid";

    public static ValidationResult ok() {
        return new ValidationResult(true, VALID_MESSAGE);
    }

    public static ValidationResult invalid(String message) {
        return new ValidationResult(false, message);
    }
}
