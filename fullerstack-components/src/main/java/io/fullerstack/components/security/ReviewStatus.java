package io.fullerstack.components.security;

import java.time.Instant;
import java.util.Objects;

/**
 * Code review state of a component.
 * <p>
 * {@code reviewer}, {@code reason} and {@code decidedAt} are null unless the state
 * carries them: APPROVED has reviewer and time, REJECTED has all three.
 */
public record ReviewStatus(State state, String reviewer, String reason, Instant decidedAt) {

    public enum State {
        PENDING,
        IN_PROGRESS,
        APPROVED,
        REJECTED
    }

    private static final ReviewStatus PENDING = new ReviewStatus(State.PENDING, null, null, null);
    private static final ReviewStatus IN_PROGRESS = new ReviewStatus(State.IN_PROGRESS, null, null, null);

    public ReviewStatus {
        Objects.requireNonNull(state, "state");
        switch (state) {
            case APPROVED -> {
                Objects.requireNonNull(reviewer, "reviewer");
                Objects.requireNonNull(decidedAt, "decidedAt");
            }
            case REJECTED -> {
                Objects.requireNonNull(reviewer, "reviewer");
                Objects.requireNonNull(reason, "reason");
                Objects.requireNonNull(decidedAt, "decidedAt");
            }
            default -> {
                if (reviewer != null || reason != null || decidedAt != null) {
                    throw new IllegalArgumentException(state + " carries no reviewer, reason or time");
                }
            }
        }
    }

    public static ReviewStatus pending() {
        return PENDING;
    }

    public static ReviewStatus inProgress() {
        return IN_PROGRESS;
    }

    public static ReviewStatus approved(String reviewer, Instant decidedAt) {
        return new ReviewStatus(State.APPROVED, reviewer, null, decidedAt);
    }

    public static ReviewStatus rejected(String reviewer, String reason, Instant decidedAt) {
        return new ReviewStatus(State.REJECTED, reviewer, reason, decidedAt);
    }

    public boolean isApproved() {
        return state == State.APPROVED;
    }
}
