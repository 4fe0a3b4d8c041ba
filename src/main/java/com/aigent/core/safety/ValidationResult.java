package com.aigent.core.safety;

/**
 * Verdict of a {@link SafetyValidator}.
 *
 * @param valid   whether the action may be executed
 * @param message reason for a rejection; null when valid
 */
public record ValidationResult(boolean valid, String message) {

    public static ValidationResult ok() {
        return new ValidationResult(true, null);
    }

    public static ValidationResult rejected(String message) {
        return new ValidationResult(false, message);
    }
}
