package com.hronboard.backend.global.error;

public class AccountLockedException extends ProblemException {

    private final long minutesRemaining;

    public AccountLockedException(long minutesRemaining) {
        super(ProblemKind.ACCOUNT_LOCKED, "auth.account_locked",
                "Account is temporarily locked. Try again in " + minutesRemaining + " minutes.");
        if (minutesRemaining < 0) {
            throw new IllegalArgumentException("minutesRemaining must be >= 0");
        }
        this.minutesRemaining = minutesRemaining;
    }

    public long getMinutesRemaining() {
        return minutesRemaining;
    }
}
