package com.example.eventsub.model;

/**
 * 一次订阅尝试的结果，message 用于直接回复给用户。
 */
public record EnrollmentResult(Outcome outcome, String message) {

    public enum Outcome {
        INELIGIBLE,
        ON_COOLDOWN,
        ALREADY_SUBSCRIBED,
        SUBSCRIBED,
        FAILED
    }

    public boolean isSuccess() {
        return outcome == Outcome.SUBSCRIBED || outcome == Outcome.ALREADY_SUBSCRIBED;
    }

    public static EnrollmentResult ineligible(EventSubType type) {
        return new EnrollmentResult(Outcome.INELIGIBLE,
                "Missing permissions for " + type.name() + ", required scopes: " + String.join(", ", type.requiredScopes()));
    }

    public static EnrollmentResult onCooldown(EventSubType type) {
        return new EnrollmentResult(Outcome.ON_COOLDOWN,
                "A subscription to " + type.name() + " was attempted recently, try again later");
    }

    public static EnrollmentResult alreadySubscribed(EventSubType type) {
        return new EnrollmentResult(Outcome.ALREADY_SUBSCRIBED, "Already subscribed to " + type.name());
    }

    public static EnrollmentResult subscribed(EventSubType type) {
        return new EnrollmentResult(Outcome.SUBSCRIBED, "Subscribed to " + type.name());
    }

    public static EnrollmentResult failed(EventSubType type) {
        return new EnrollmentResult(Outcome.FAILED, "Failed to subscribe to " + type.name());
    }
}
