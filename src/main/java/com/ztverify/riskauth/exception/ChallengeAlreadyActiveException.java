package com.ztverify.riskauth.exception;

/**
 * Thrown when a new one-time code is requested while the previous one is still usable.
 */
public class ChallengeAlreadyActiveException extends RuntimeException {

    private final long remainingSeconds;

    public ChallengeAlreadyActiveException(long remainingSeconds) {
        this("A verification code is already active", remainingSeconds);
    }

    public ChallengeAlreadyActiveException(String message, long remainingSeconds) {
        super(message);
        this.remainingSeconds = remainingSeconds;
    }

    public long getRemainingSeconds() {
        return remainingSeconds;
    }
}
